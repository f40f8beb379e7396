package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.NoHistoryException;
import com.baykanat.musicstream.domain.model.AggregateRecord;
import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.FinalizedBucket;
import com.baykanat.musicstream.domain.model.GenreShare;
import com.baykanat.musicstream.domain.model.UserProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Finalize edilmiş USER / USER_GENRE / USER_ARTIST aggregate'lerinden kullanıcı profili kurar. */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileService {

    private final WindowedAggregator aggregator;
    private final AppProperties appProperties;

    /** Profil lookback süresindeki finalize bucket'lardan profil; geçmiş yoksa boş profil döner. */
    public UserProfile profile(String userId, Instant now) {
        Instant from = now.minus(Duration.ofDays(appProperties.getRecommendation().getProfileLookbackDays()));
        String prefix = EntityType.userPrefix(userId);

        Map<String, Long> genrePlays = new HashMap<>();
        Map<String, Long> artistPlays = new HashMap<>();
        long totalPlays = 0;
        long totalDuration = 0;

        for (FinalizedBucket bucket : aggregator.finalizedSnapshot().scan(from, now)) {
            for (AggregateRecord record : bucket.select(EntityType.USER_GENRE, id -> id.startsWith(prefix))) {
                genrePlays.merge(EntityType.valuePart(record.getKey().getEntityId()), record.getPlayCount(), Long::sum);
            }
            for (AggregateRecord record : bucket.select(EntityType.USER_ARTIST, id -> id.startsWith(prefix))) {
                artistPlays.merge(EntityType.valuePart(record.getKey().getEntityId()), record.getPlayCount(), Long::sum);
            }
            for (AggregateRecord record : bucket.select(EntityType.USER, userId::equals)) {
                totalPlays += record.getPlayCount();
                totalDuration += record.getTotalDurationMs();
            }
        }

        log.debug("Built profile for user_id={}: {} plays, {} genres, {} artists",
                userId, totalPlays, genrePlays.size(), artistPlays.size());
        return UserProfile.builder()
                .userId(userId)
                .genrePlays(Map.copyOf(genrePlays))
                .artistPlays(Map.copyOf(artistPlays))
                .totalPlays(totalPlays)
                .totalDurationMs(totalDuration)
                .build();
    }

    /** Kullanıcının en çok dinlediği genre'ler; yüzde tek ondalığa yuvarlanır. Eşitlikte genre adı artan. */
    public List<GenreShare> topGenres(String userId, int limit, Instant now) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        UserProfile profile = profile(userId, now);
        if (profile.isEmpty()) {
            throw new NoHistoryException(userId);
        }
        long total = profile.getTotalPlays();
        return profile.getGenrePlays().entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(e -> new GenreShare(e.getKey(), e.getValue(), Math.round(e.getValue() * 1000.0 / total) / 10.0))
                .toList();
    }
}
