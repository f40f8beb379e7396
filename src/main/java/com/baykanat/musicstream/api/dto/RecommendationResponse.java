package com.baykanat.musicstream.api.dto;

import com.baykanat.musicstream.domain.model.RecommendationList;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scored track recommendations for a user")
public class RecommendationResponse {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("generated_at")
    private String generatedAt;

    @JsonProperty("recommendations")
    private List<Item> recommendations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        @JsonProperty("track_id")
        private String trackId;
        @JsonProperty("confidence")
        @Schema(description = "Model confidence in [0,1]", example = "0.87")
        private double confidence;
    }

    public static RecommendationResponse from(RecommendationList list) {
        return RecommendationResponse.builder()
                .userId(list.getUserId())
                .generatedAt(list.getGeneratedAt().toString())
                .recommendations(list.getResults().stream()
                        .map(r -> new Item(r.getTrackId(), r.getConfidence()))
                        .toList())
                .build();
    }
}
