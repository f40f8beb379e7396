package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.InsufficientDataException;
import com.baykanat.musicstream.domain.model.AggregateRecord;
import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.FinalizedBucket;
import com.baykanat.musicstream.domain.model.FinalizedSnapshot;
import com.baykanat.musicstream.domain.model.TrendRanking;
import com.baykanat.musicstream.domain.model.TrendScore;
import com.baykanat.musicstream.domain.model.WindowBucket;
import com.baykanat.musicstream.infrastructure.persistence.TrendScoreJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finalize edilmiş aggregate'lerden trend skoru hesaplar.
 *
 * <p>Mevcut dönem [now - days, now), önceki dönem [now - 2*days, now - days). Skor:
 * growthWeight * (current - previous) / max(previous, volumeFloor) + volumeWeight * current / maxCurrent.
 * Eşit skorda entity_id artan. Her döngü tam bir liste üretir; yayınlanan sıralama bütün olarak değişir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrendRanker {

    private final WindowedAggregator aggregator;
    private final TrendScoreJdbcRepository trendScoreRepository;
    private final AppProperties appProperties;

    private final Map<EntityType, TrendRanking> latestRankings = new ConcurrentHashMap<>();

    public TrendRanking rank(EntityType entityType, int days, int limit, Instant now) {
        if (entityType.isProfileDimension()) {
            throw new IllegalArgumentException("Trend ranking is not supported for " + entityType);
        }
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }

        Duration lookback = Duration.ofDays(days);
        Instant currentStart = now.minus(lookback);
        Instant previousStart = currentStart.minus(lookback);

        FinalizedSnapshot snapshot = aggregator.finalizedSnapshot();
        List<FinalizedBucket> currentBuckets = snapshot.scan(currentStart, now);
        if (currentBuckets.isEmpty()) {
            throw new InsufficientDataException(
                    "No finalized buckets in the last " + days + " days",
                    "entity_type=" + entityType + ", days=" + days + ", window=[" + currentStart + ", " + now + ")");
        }

        Map<String, Long> current = sumPlays(currentBuckets, entityType);
        Map<String, Long> previous = sumPlays(snapshot.scan(previousStart, currentStart), entityType);
        long maxCurrent = current.values().stream().mapToLong(Long::longValue).max().orElse(0L);

        AppProperties.TrendProperties props = appProperties.getTrend();
        WindowBucket window = new WindowBucket(currentStart, now);

        List<TrendScore> unranked = new ArrayList<>(current.size());
        for (Map.Entry<String, Long> entry : current.entrySet()) {
            long cur = entry.getValue();
            long prev = previous.getOrDefault(entry.getKey(), 0L);
            double growth = (cur - prev) / (double) Math.max(prev, Math.max(1L, props.getVolumeFloor()));
            double volume = maxCurrent == 0 ? 0.0 : cur / (double) maxCurrent;
            double score = props.getGrowthWeight() * growth + props.getVolumeWeight() * volume;

            unranked.add(TrendScore.builder()
                    .entityType(entityType)
                    .entityId(entry.getKey())
                    .window(window)
                    .score(score)
                    .currentPlays(cur)
                    .previousPlays(prev)
                    .build());
        }

        unranked.sort(Comparator.comparingDouble(TrendScore::getScore).reversed()
                .thenComparing(TrendScore::getEntityId));

        List<TrendScore> ranked = new ArrayList<>(Math.min(limit, unranked.size()));
        for (int i = 0; i < unranked.size() && i < limit; i++) {
            TrendScore s = unranked.get(i);
            ranked.add(TrendScore.builder()
                    .entityType(s.getEntityType())
                    .entityId(s.getEntityId())
                    .window(s.getWindow())
                    .score(s.getScore())
                    .rank(i + 1)
                    .currentPlays(s.getCurrentPlays())
                    .previousPlays(s.getPreviousPlays())
                    .build());
        }

        return new TrendRanking(entityType, days, window, now, ranked);
    }

    /** Bir döngü hesaplar, storage'da tam olarak değiştirir ve son sıralama olarak yayınlar. */
    public TrendRanking refresh(EntityType entityType, int days, int limit, Instant now) {
        TrendRanking ranking = rank(entityType, days, limit, now);
        trendScoreRepository.replaceAll(ranking);
        latestRankings.put(entityType, ranking);
        log.info("Trend refresh: entity_type={}, days={}, {} entries", entityType, days, ranking.getScores().size());
        return ranking;
    }

    public Optional<TrendRanking> latest(EntityType entityType) {
        return Optional.ofNullable(latestRankings.get(entityType));
    }

    private static Map<String, Long> sumPlays(List<FinalizedBucket> buckets, EntityType entityType) {
        Map<String, Long> plays = new HashMap<>();
        for (FinalizedBucket bucket : buckets) {
            for (AggregateRecord record : bucket.select(entityType, id -> true)) {
                plays.merge(record.getKey().getEntityId(), record.getPlayCount(), Long::sum);
            }
        }
        return plays;
    }
}
