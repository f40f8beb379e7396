package com.baykanat.musicstream.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** Finalize edilmiş aggregate'lerden türetilen kullanıcı profili (genre/artist affinity). */
@Value
@Builder
public class UserProfile {

    String userId;
    Map<String, Long> genrePlays;
    Map<String, Long> artistPlays;
    long totalPlays;
    long totalDurationMs;

    public boolean isEmpty() {
        return totalPlays == 0;
    }

    /** Genre'nin oynatmalar içindeki payı, [0,1]. */
    public double genreAffinity(String genre) {
        return totalPlays == 0 ? 0.0 : genrePlays.getOrDefault(genre, 0L) / (double) totalPlays;
    }

    /** Artist'in oynatmalar içindeki payı, [0,1]. */
    public double artistAffinity(String artistId) {
        return totalPlays == 0 ? 0.0 : artistPlays.getOrDefault(artistId, 0L) / (double) totalPlays;
    }
}
