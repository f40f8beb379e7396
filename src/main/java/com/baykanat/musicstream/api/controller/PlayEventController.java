package com.baykanat.musicstream.api.controller;

import com.baykanat.musicstream.api.dto.BulkPlayEventRequest;
import com.baykanat.musicstream.api.dto.IngestionResponse;
import com.baykanat.musicstream.api.dto.PlayEventRequest;
import com.baykanat.musicstream.infrastructure.kafka.PlayEventKafkaProducer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /play-events ve POST /play-events/bulk. Event Kafka'ya gönderilir, 202 döner; aggregation consumer'da. */
@Slf4j
@RestController
@RequestMapping("/play-events")
@RequiredArgsConstructor
@Tag(name = "Play Event Ingestion", description = "Endpoints for ingesting listening events")
public class PlayEventController {

    private final PlayEventKafkaProducer kafkaProducer;

    @PostMapping
    @Operation(summary = "Ingest a single play event", description = "Accepts and queues a play event for aggregation")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Play event accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid play event payload"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable (Kafka down)")
    })
    public ResponseEntity<IngestionResponse> ingestEvent(@Valid @RequestBody PlayEventRequest event) throws Exception {
        log.debug("Received play event: user_id={}, track_id={}", event.getUserId(), event.getTrackId());

        String eventId = kafkaProducer.send(event);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(IngestionResponse.builder()
                        .status("accepted")
                        .acceptedCount(1)
                        .message("Play event queued for aggregation")
                        .eventId(eventId)
                        .build());
    }

    /** En fazla 1000 event; hepsi doğrulanıp Kafka'ya paralel gönderilir. Tekrarlanan event_id'ler bir kez sayılır. */
    @PostMapping("/bulk")
    @Operation(summary = "Bulk ingest play events", description = "Accepts up to 1000 play events for aggregation")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Play events accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid play event payload(s)"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable")
    })
    public ResponseEntity<IngestionResponse> ingestBulkEvents(@Valid @RequestBody BulkPlayEventRequest bulkRequest) throws Exception {
        log.debug("Received bulk request with {} play events", bulkRequest.getEvents().size());

        int accepted = kafkaProducer.sendBatch(bulkRequest.getEvents());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(IngestionResponse.builder()
                        .status("accepted")
                        .acceptedCount(accepted)
                        .message("Play events queued for aggregation")
                        .build());
    }
}
