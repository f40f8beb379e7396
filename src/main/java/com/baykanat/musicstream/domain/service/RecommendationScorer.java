package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.ModelUnavailableException;
import com.baykanat.musicstream.domain.exception.NoHistoryException;
import com.baykanat.musicstream.domain.model.CatalogTrack;
import com.baykanat.musicstream.domain.model.RecommendationList;
import com.baykanat.musicstream.domain.model.RecommendationResult;
import com.baykanat.musicstream.domain.model.UserProfile;
import com.baykanat.musicstream.domain.port.ScoringModel;
import com.baykanat.musicstream.domain.port.TrackCatalog;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kullanıcı profili + harici model ile parça önerisi üretir. Exclusion penceresinde dinlenen parçalar aday
 * olmaz. Model çağrıları timeout ile sınırlıdır; hata veya süre aşımı caller'a ModelUnavailableException
 * olarak döner, default skorla ikame edilmez.
 */
@Slf4j
@Service
public class RecommendationScorer {

    /** confidence azalan, added_at azalan (bilinmeyen en sonda), track_id artan. */
    private static final Comparator<Scored> RANKING = Comparator
            .comparingDouble((Scored s) -> s.confidence).reversed()
            .thenComparing((Scored s) -> s.track.getAddedAt(), Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing((Scored s) -> s.track.getTrackId());

    private final UserProfileService userProfileService;
    private final WindowedAggregator aggregator;
    private final TrackCatalog trackCatalog;
    private final ScoringModel scoringModel;
    private final AsyncTaskExecutor scoringExecutor;
    private final AppProperties appProperties;
    private final Counter modelFailureCounter;

    public RecommendationScorer(UserProfileService userProfileService,
                                WindowedAggregator aggregator,
                                TrackCatalog trackCatalog,
                                ScoringModel scoringModel,
                                @Qualifier("scoringExecutor") AsyncTaskExecutor scoringExecutor,
                                AppProperties appProperties,
                                MeterRegistry meterRegistry) {
        this.userProfileService = userProfileService;
        this.aggregator = aggregator;
        this.trackCatalog = trackCatalog;
        this.scoringModel = scoringModel;
        this.scoringExecutor = scoringExecutor;
        this.appProperties = appProperties;
        this.modelFailureCounter = meterRegistry.counter("musicstream.recommendation.model_failures");
    }

    /** En fazla n öneri; confidence azalan, eşitlikte kataloğa en son eklenen önce. */
    public RecommendationList recommend(String userId, int n, Instant now) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive");
        }
        AppProperties.RecommendationProperties props = appProperties.getRecommendation();

        UserProfile profile = userProfileService.profile(userId, now);
        if (profile.isEmpty()) {
            throw new NoHistoryException(userId);
        }

        Set<String> excluded = aggregator.recentTracks(userId, now.minus(props.getExclusionWindow()));
        List<CatalogTrack> candidates = candidatesFor(profile, excluded, props);
        log.debug("Scoring {} candidates for user_id={} ({} tracks excluded)", candidates.size(), userId, excluded.size());

        List<Double> confidences = scoreAll(profile, candidates, props.getModelTimeout().toMillis());
        List<Scored> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            scored.add(new Scored(candidates.get(i), confidences.get(i)));
        }
        scored.sort(RANKING);

        List<RecommendationResult> results = scored.stream()
                .limit(n)
                .map(s -> new RecommendationResult(userId, s.track.getTrackId(), s.confidence, now))
                .toList();

        return new RecommendationList(userId, now, results);
    }

    private List<CatalogTrack> candidatesFor(UserProfile profile, Set<String> excluded,
                                             AppProperties.RecommendationProperties props) {
        List<String> genres = topKeys(profile.getGenrePlays(), props.getTopAffinities());
        List<String> artists = topKeys(profile.getArtistPlays(), props.getTopAffinities());

        Map<String, CatalogTrack> distinct = new LinkedHashMap<>();
        for (CatalogTrack track : trackCatalog.findCandidates(genres, artists, props.getCandidateLimit())) {
            if (!excluded.contains(track.getTrackId())) {
                distinct.putIfAbsent(track.getTrackId(), track);
            }
        }
        return new ArrayList<>(distinct.values());
    }

    /**
     * Adayları paralel skorlar; her çağrı timeoutMs ile sınırlı. İlk hata kalan çağrıları iptal eder; iptal
     * çalışan thread'i interrupt eder. Bloklu HTTP okumasında asıl sınır RestClient read timeout'udur.
     */
    private List<Double> scoreAll(UserProfile profile, List<CatalogTrack> candidates, long timeoutMs) {
        List<Future<Double>> futures = new ArrayList<>(candidates.size());
        try {
            for (CatalogTrack track : candidates) {
                futures.add(scoringExecutor.submit(() -> scoringModel.score(profile, track, timeoutMs)));
            }
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            throw modelFailure("Scoring executor saturated", profile.getUserId(), null, e);
        }

        List<Double> confidences = new ArrayList<>(candidates.size());
        for (int i = 0; i < futures.size(); i++) {
            String trackId = candidates.get(i).getTrackId();
            try {
                double confidence = futures.get(i).get(timeoutMs, TimeUnit.MILLISECONDS);
                if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                    throw modelFailure("Model returned confidence outside [0,1]: " + confidence,
                            profile.getUserId(), trackId, null);
                }
                confidences.add(confidence);
            } catch (TimeoutException e) {
                cancelAll(futures);
                throw modelFailure("Scoring model timed out after " + timeoutMs + "ms", profile.getUserId(), trackId, e);
            } catch (ExecutionException e) {
                cancelAll(futures);
                throw modelFailure("Scoring model call failed: " + e.getCause().getMessage(),
                        profile.getUserId(), trackId, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw modelFailure("Interrupted while waiting for scoring model", profile.getUserId(), trackId, e);
            } catch (ModelUnavailableException e) {
                cancelAll(futures);
                throw e;
            }
        }
        return confidences;
    }

    private ModelUnavailableException modelFailure(String message, String userId, String trackId, Throwable cause) {
        modelFailureCounter.increment();
        String context = "user_id=" + userId + (trackId != null ? ", track_id=" + trackId : "");
        log.warn("Recommendation scoring failed: {} ({})", message, context);
        return new ModelUnavailableException(message, context,
                appProperties.getRecommendation().getRetryAfterSeconds(), cause);
    }

    private static void cancelAll(List<Future<Double>> futures) {
        futures.forEach(f -> f.cancel(true));
    }

    private static final class Scored {
        private final CatalogTrack track;
        private final double confidence;

        private Scored(CatalogTrack track, double confidence) {
            this.track = track;
            this.confidence = confidence;
        }
    }

    private static List<String> topKeys(Map<String, Long> counts, int k) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(k)
                .map(Map.Entry::getKey)
                .toList();
    }
}
