package com.baykanat.musicstream.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Ham play event payload'ı; API katmanında doğrulanır, Kafka'dan gelen kayıtlar normalizer'da tekrar doğrulanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Raw play event payload")
public class PlayEventRequest {

    @JsonProperty("event_id")
    @Schema(description = "Client-supplied event id; derived from the payload when absent", example = "evt_01HZX3")
    private String eventId;

    @NotBlank(message = "user_id is required")
    @JsonProperty("user_id")
    @Schema(description = "Listener identifier", example = "user_123")
    private String userId;

    @NotBlank(message = "track_id is required")
    @JsonProperty("track_id")
    @Schema(description = "Played track identifier", example = "trk_456")
    private String trackId;

    @JsonProperty("artist_id")
    @Schema(description = "Track artist identifier", example = "art_789")
    private String artistId;

    @JsonProperty("genre")
    @Schema(description = "Track genre", example = "rock")
    private String genre;

    @NotNull(message = "timestamp is required")
    @Positive(message = "timestamp must be a positive Unix epoch value")
    @Max(value = 253402300799L, message = "timestamp is out of range")
    @JsonProperty("timestamp")
    @Schema(description = "Play timestamp as Unix epoch seconds", example = "1771156800")
    private Long timestamp;

    @PositiveOrZero(message = "duration_played_ms must be >= 0")
    @JsonProperty("duration_played_ms")
    @Schema(description = "Milliseconds actually played", example = "183000")
    private Long durationPlayedMs;

    @JsonProperty("device")
    @Schema(description = "Playback device", example = "mobile")
    private String device;

    @JsonProperty("context")
    @Schema(description = "Playback context (playlist, album, radio...)", example = "playlist")
    private String context;
}
