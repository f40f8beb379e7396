package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.api.dto.PlayEventRequest;
import com.baykanat.musicstream.domain.exception.EventValidationException;
import com.baykanat.musicstream.domain.model.ApplyOutcome;
import com.baykanat.musicstream.domain.model.IngestionSummary;
import com.baykanat.musicstream.domain.model.PlayEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Kafka consumer tarafı: her payload normalize edilir, aggregator'a uygulanır. Geçersiz event'ler düşürülür ve sayılır. */
@Slf4j
@Service
public class PlayEventIngestionService {

    private final EventNormalizer eventNormalizer;
    private final WindowedAggregator aggregator;
    private final Counter invalidCounter;

    public PlayEventIngestionService(EventNormalizer eventNormalizer, WindowedAggregator aggregator,
                                     MeterRegistry meterRegistry) {
        this.eventNormalizer = eventNormalizer;
        this.aggregator = aggregator;
        this.invalidCounter = meterRegistry.counter("musicstream.events.invalid");
    }

    /** Batch'i işler; sonuç sayılarını döner. Aggregator dedup yaptığı için tekrar işlenen batch sayıları bozmaz. */
    public IngestionSummary processBatch(List<PlayEventRequest> events) {
        if (events.isEmpty()) {
            return new IngestionSummary(0, 0, 0, 0);
        }

        int applied = 0;
        int duplicates = 0;
        int droppedLate = 0;
        int invalid = 0;

        for (PlayEventRequest request : events) {
            PlayEvent event;
            try {
                event = eventNormalizer.normalize(request, aggregator.currentWatermark());
            } catch (EventValidationException e) {
                invalidCounter.increment();
                invalid++;
                log.warn("Dropped invalid play event: field={}, reason={}, {}", e.getField(), e.getMessage(), e.getContext());
                continue;
            }

            ApplyOutcome outcome = aggregator.apply(event);
            switch (outcome) {
                case APPLIED, APPLIED_LATE -> applied++;
                case DUPLICATE -> duplicates++;
                case DROPPED_LATE -> droppedLate++;
            }
        }

        IngestionSummary summary = new IngestionSummary(applied, duplicates, droppedLate, invalid);
        log.info("Processed batch: {} applied, {} duplicates, {} dropped late, {} invalid",
                applied, duplicates, droppedLate, invalid);
        return summary;
    }
}
