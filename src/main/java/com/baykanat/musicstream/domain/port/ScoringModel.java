package com.baykanat.musicstream.domain.port;

import com.baykanat.musicstream.domain.exception.ModelUnavailableException;
import com.baykanat.musicstream.domain.model.CatalogTrack;
import com.baykanat.musicstream.domain.model.UserProfile;

/**
 * Harici öneri modeli. Model ağırlıkları bu servisin dışında eğitilir ve sunulur;
 * burada yalnızca skor fonksiyonu olarak görünür.
 */
public interface ScoringModel {

    /**
     * Aday parça için kullanıcı profiline göre güven skoru.
     *
     * @param profile   kullanıcının aggregate profili
     * @param candidate aday parça
     * @param timeoutMs çağrı için üst sınır; aşılırsa hata sayılır
     * @return [0,1] aralığında confidence
     * @throws ModelUnavailableException model erişilemez veya süre aşıldıysa
     */
    double score(UserProfile profile, CatalogTrack candidate, long timeoutMs);
}
