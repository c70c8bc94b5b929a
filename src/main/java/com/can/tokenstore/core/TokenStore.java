package com.can.tokenstore.core;

/**
 * Kısa ömürlü token'ları (tek kullanımlık kodlar, captcha rakamları) kimliğe
 * göre saklayan depolama sözleşmesidir. Kod üreten bileşenler yalnızca bu
 * arayüzü kullanır; varsayılan implementasyon {@link MemoryTokenStore} olup
 * uygulama kendi bean'ini sağlayarak onu değiştirebilir.
 */
public interface TokenStore
{
    /**
     * Verilen kimlik için değeri ekler ya da üzerine yazar.
     */
    void set(String id, String value);

    /**
     * Kimliğe karşılık gelen değeri döndürür. {@code clear} true ise değer aynı
     * atomik adımda depodan silinir. Kayıt yoksa boş string döner; saklanmış boş
     * bir değer ile eksik kayıt ayırt edilemez.
     */
    String get(String id, boolean clear);
}
