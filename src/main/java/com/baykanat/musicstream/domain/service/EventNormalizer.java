package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.api.dto.PlayEventRequest;
import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.EventValidationException;
import com.baykanat.musicstream.domain.mapper.PlayEventMapper;
import com.baykanat.musicstream.domain.model.PlayEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Ham payload'ı kanonik PlayEvent'e çevirir. Yan etkisi yok; geçersiz alan için
 * EventValidationException fırlatır. Watermark'tan eski timestamp'ler kabul edilir, late işaretlenir.
 */
@Service
@RequiredArgsConstructor
public class EventNormalizer {

    /** 9999-12-31T23:59:59Z; üstü Instant'a çevrilemeyebilir, geçersiz sayılır. */
    public static final long MAX_TIMESTAMP_SECONDS = 253402300799L;

    private final PlayEventMapper playEventMapper;
    private final IdempotencyService idempotencyService;
    private final AppProperties appProperties;
    private final Clock clock;

    public PlayEvent normalize(PlayEventRequest payload, Instant watermark) {
        if (payload == null) {
            throw new EventValidationException("payload", "must not be null", "payload=null");
        }
        String context = contextOf(payload);

        requireText(payload.getUserId(), "user_id", context);
        requireText(payload.getTrackId(), "track_id", context);

        if (payload.getTimestamp() == null) {
            throw new EventValidationException("timestamp", "is required", context);
        }
        if (payload.getTimestamp() <= 0) {
            throw new EventValidationException("timestamp", "must be a positive Unix epoch value", context);
        }
        if (payload.getTimestamp() > MAX_TIMESTAMP_SECONDS) {
            throw new EventValidationException("timestamp", "is out of range: " + payload.getTimestamp(), context);
        }
        Instant timestamp = Instant.ofEpochSecond(payload.getTimestamp());
        Instant latestAccepted = clock.instant().plus(appProperties.getAggregation().getMaxClockSkew());
        if (timestamp.isAfter(latestAccepted)) {
            throw new EventValidationException("timestamp", "is in the future: " + timestamp, context);
        }

        if (payload.getDurationPlayedMs() != null && payload.getDurationPlayedMs() < 0) {
            throw new EventValidationException("duration_played_ms", "must be >= 0", context);
        }

        String eventId = payload.getEventId() != null && !payload.getEventId().isBlank()
                ? payload.getEventId().trim()
                : idempotencyService.generateEventId(payload);
        boolean late = watermark != null && timestamp.isBefore(watermark);

        return playEventMapper.toPlayEvent(payload, eventId, late);
    }

    private static void requireText(String value, String field, String context) {
        if (value == null || value.isBlank()) {
            throw new EventValidationException(field, "is required", context);
        }
    }

    private static String contextOf(PlayEventRequest payload) {
        return "event_id=" + payload.getEventId()
                + ", user_id=" + payload.getUserId()
                + ", track_id=" + payload.getTrackId();
    }
}
