package com.baykanat.musicstream.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Ingestion yanıtı: 202 ile status, kabul edilen event sayısı ve tek event için atanan event_id. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Response for play event ingestion")
public class IngestionResponse {

    @Schema(description = "Status message", example = "accepted")
    private String status;

    @Schema(description = "Number of events accepted", example = "1")
    private int acceptedCount;

    @Schema(description = "Additional message", example = "Play events queued for aggregation")
    private String message;

    @JsonProperty("event_id")
    @Schema(description = "Event id the single event was queued with", example = "evt_01HZX3")
    private String eventId;
}
