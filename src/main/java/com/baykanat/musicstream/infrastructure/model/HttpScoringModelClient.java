package com.baykanat.musicstream.infrastructure.model;

import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.ModelUnavailableException;
import com.baykanat.musicstream.domain.model.CatalogTrack;
import com.baykanat.musicstream.domain.model.UserProfile;
import com.baykanat.musicstream.domain.port.ScoringModel;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Harici skorlama servisine HTTP çağrısı; Circuit Breaker açıkken veya hata olursa ModelUnavailableException. */
@Slf4j
@Component
public class HttpScoringModelClient implements ScoringModel {

    private final RestClient restClient;
    private final AppProperties appProperties;

    public HttpScoringModelClient(@Qualifier("scoringRestClient") RestClient restClient, AppProperties appProperties) {
        this.restClient = restClient;
        this.appProperties = appProperties;
    }

    @Override
    @CircuitBreaker(name = "scoringModel", fallbackMethod = "scoreFallback")
    public double score(UserProfile profile, CatalogTrack candidate, long timeoutMs) {
        ScoreRequest request = ScoreRequest.builder()
                .userId(profile.getUserId())
                .trackId(candidate.getTrackId())
                .artistId(candidate.getArtistId())
                .genre(candidate.getGenre())
                .genreAffinity(profile.genreAffinity(candidate.getGenre()))
                .artistAffinity(profile.artistAffinity(candidate.getArtistId()))
                .totalPlays(profile.getTotalPlays())
                .timeoutMs(timeoutMs)
                .build();

        ScoreResponse response = restClient.post()
                .uri(appProperties.getModel().getScorePath())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(ScoreResponse.class);

        if (response == null || response.getConfidence() == null) {
            throw new IllegalStateException("Empty response from scoring model for track_id=" + candidate.getTrackId());
        }
        return response.getConfidence();
    }

    @SuppressWarnings("unused")
    private double scoreFallback(UserProfile profile, CatalogTrack candidate, long timeoutMs, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for scoring model. Rejecting score for user_id={}", profile.getUserId());
        throw new ModelUnavailableException("Scoring model circuit breaker is open",
                context(profile, candidate), appProperties.getRecommendation().getRetryAfterSeconds(), ex);
    }

    @SuppressWarnings("unused")
    private double scoreFallback(UserProfile profile, CatalogTrack candidate, long timeoutMs, Exception ex) {
        log.error("Scoring model call failed for user_id={}, track_id={}: {}",
                profile.getUserId(), candidate.getTrackId(), ex.getMessage());
        throw new ModelUnavailableException("Scoring model unavailable: " + ex.getMessage(),
                context(profile, candidate), appProperties.getRecommendation().getRetryAfterSeconds(), ex);
    }

    private static String context(UserProfile profile, CatalogTrack candidate) {
        return "user_id=" + profile.getUserId() + ", track_id=" + candidate.getTrackId();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class ScoreRequest {
        @JsonProperty("user_id")
        private String userId;
        @JsonProperty("track_id")
        private String trackId;
        @JsonProperty("artist_id")
        private String artistId;
        @JsonProperty("genre")
        private String genre;
        @JsonProperty("genre_affinity")
        private double genreAffinity;
        @JsonProperty("artist_affinity")
        private double artistAffinity;
        @JsonProperty("total_plays")
        private long totalPlays;
        @JsonProperty("timeout_ms")
        private long timeoutMs;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ScoreResponse {
        @JsonProperty("confidence")
        private Double confidence;
    }
}
