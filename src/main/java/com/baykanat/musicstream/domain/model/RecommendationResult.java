package com.baykanat.musicstream.domain.model;

import lombok.Value;

import java.time.Instant;

@Value
public class RecommendationResult {

    String userId;
    String trackId;
    double confidence;
    Instant generatedAt;
}
