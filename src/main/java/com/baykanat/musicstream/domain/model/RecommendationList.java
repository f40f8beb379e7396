package com.baykanat.musicstream.domain.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/** generatedAt'e bağlı değişmez öneri snapshot'ı. */
@Value
public class RecommendationList {

    String userId;
    Instant generatedAt;
    List<RecommendationResult> results;

    public RecommendationList(String userId, Instant generatedAt, List<RecommendationResult> results) {
        this.userId = userId;
        this.generatedAt = generatedAt;
        this.results = List.copyOf(results);
    }
}
