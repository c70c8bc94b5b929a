package com.can.tokenstore.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tahliye kuyruğunda bir token'ın ekleniş anını tutan kayıt türüdür. Kuyruk
 * ekleme sırasını koruduğu için düğümler yaşa göre de sıralıdır.
 */
record QueueNode(String id, Instant insertedAt)
{
    QueueNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(insertedAt, "insertedAt");
    }

    boolean expired(Duration expiration, Instant now) {
        return Duration.between(insertedAt, now).compareTo(expiration) > 0;
    }
}
