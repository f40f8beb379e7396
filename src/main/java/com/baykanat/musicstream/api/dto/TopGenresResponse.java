package com.baykanat.musicstream.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Kullanıcının en çok dinlediği genre'ler ve yüzdeleri. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A user's top genres by share of plays")
public class TopGenresResponse {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("genres")
    private List<GenreEntry> genres;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenreEntry {
        @JsonProperty("genre")
        @Schema(example = "rock")
        private String genre;
        @JsonProperty("play_count")
        @Schema(example = "60")
        private long playCount;
        @JsonProperty("percentage")
        @Schema(example = "60.0")
        private double percentage;
    }
}
