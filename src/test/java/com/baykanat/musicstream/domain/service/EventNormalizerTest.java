package com.baykanat.musicstream.domain.service;

import com.baykanat.musicstream.api.dto.PlayEventRequest;
import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.EventValidationException;
import com.baykanat.musicstream.domain.mapper.PlayEventMapper;
import com.baykanat.musicstream.domain.model.PlayEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for EventNormalizer: field validation, canonical form and late flagging.
 */
class EventNormalizerTest {

    private static final Instant NOW = Instant.parse("2026-02-15T12:00:00Z");

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EventNormalizer(
                Mappers.getMapper(PlayEventMapper.class),
                new IdempotencyService(),
                new AppProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PlayEventRequest.PlayEventRequestBuilder validPlay() {
        return PlayEventRequest.builder()
                .eventId("evt_1")
                .userId("user_123")
                .trackId("trk_456")
                .artistId("art_789")
                .genre("Rock")
                .timestamp(NOW.minusSeconds(600).getEpochSecond())
                .durationPlayedMs(183000L)
                .device("mobile")
                .context("playlist");
    }

    @Test
    @DisplayName("Valid payload is converted to a canonical play event")
    void validPayloadIsNormalized() {
        PlayEvent event = normalizer.normalize(validPlay().build(), Instant.EPOCH);

        assertThat(event.getEventId()).isEqualTo("evt_1");
        assertThat(event.getUserId()).isEqualTo("user_123");
        assertThat(event.getTrackId()).isEqualTo("trk_456");
        assertThat(event.getArtistId()).isEqualTo("art_789");
        assertThat(event.getGenre()).isEqualTo("rock");
        assertThat(event.getTimestamp()).isEqualTo(NOW.minusSeconds(600));
        assertThat(event.getDurationPlayedMs()).isEqualTo(183000L);
        assertThat(event.isLate()).isFalse();
    }

    @Test
    @DisplayName("Missing event_id is derived deterministically from the payload")
    void missingEventIdIsDerived() {
        PlayEvent first = normalizer.normalize(validPlay().eventId(null).build(), Instant.EPOCH);
        PlayEvent second = normalizer.normalize(validPlay().eventId(" ").build(), Instant.EPOCH);

        assertThat(first.getEventId()).hasSize(64).isEqualTo(second.getEventId());
    }

    @Test
    @DisplayName("Missing artist, genre and duration fall back to defaults")
    void optionalFieldsDefault() {
        PlayEvent event = normalizer.normalize(
                validPlay().artistId(null).genre("  ").durationPlayedMs(null).build(), Instant.EPOCH);

        assertThat(event.getArtistId()).isEqualTo("unknown");
        assertThat(event.getGenre()).isEqualTo("unknown");
        assertThat(event.getDurationPlayedMs()).isZero();
    }

    @Test
    @DisplayName("Timestamp older than the watermark is accepted and flagged late")
    void olderThanWatermarkIsLate() {
        PlayEvent event = normalizer.normalize(validPlay().build(), NOW.minusSeconds(60));

        assertThat(event.isLate()).isTrue();
    }

    @Test
    @DisplayName("Missing user_id is rejected with the field named")
    void missingUserIdIsRejected() {
        assertThatThrownBy(() -> normalizer.normalize(validPlay().userId(null).build(), Instant.EPOCH))
                .isInstanceOf(EventValidationException.class)
                .satisfies(e -> assertThat(((EventValidationException) e).getField()).isEqualTo("user_id"));
    }

    @Test
    @DisplayName("Blank track_id is rejected")
    void blankTrackIdIsRejected() {
        assertThatThrownBy(() -> normalizer.normalize(validPlay().trackId("  ").build(), Instant.EPOCH))
                .isInstanceOf(EventValidationException.class)
                .hasMessageStartingWith("track_id");
    }

    @Test
    @DisplayName("Non-positive timestamp is rejected")
    void nonPositiveTimestampIsRejected() {
        assertThatThrownBy(() -> normalizer.normalize(validPlay().timestamp(0L).build(), Instant.EPOCH))
                .isInstanceOf(EventValidationException.class)
                .hasMessageStartingWith("timestamp");
    }

    @Test
    @DisplayName("Timestamp outside the representable range is a validation error, not a DateTimeException")
    void outOfRangeTimestampIsRejected() {
        assertThatThrownBy(() -> normalizer.normalize(validPlay().timestamp(Long.MAX_VALUE).build(), Instant.EPOCH))
                .isInstanceOf(EventValidationException.class)
                .hasMessageStartingWith("timestamp")
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> normalizer.normalize(
                validPlay().timestamp(EventNormalizer.MAX_TIMESTAMP_SECONDS + 1).build(), Instant.EPOCH))
                .isInstanceOf(EventValidationException.class);
    }

    @Test
    @DisplayName("Timestamp beyond the allowed clock skew is rejected")
    void futureTimestampIsRejected() {
        long farFuture = NOW.plusSeconds(3600).getEpochSecond();

        assertThatThrownBy(() -> normalizer.normalize(validPlay().timestamp(farFuture).build(), Instant.EPOCH))
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("future");
    }

    @Test
    @DisplayName("Timestamp within the clock skew tolerance is accepted")
    void smallSkewIsAccepted() {
        long slightlyAhead = NOW.plusSeconds(60).getEpochSecond();

        assertThat(normalizer.normalize(validPlay().timestamp(slightlyAhead).build(), Instant.EPOCH).getTimestamp())
                .isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    @DisplayName("Negative duration_played_ms is rejected")
    void negativeDurationIsRejected() {
        assertThatThrownBy(() -> normalizer.normalize(validPlay().durationPlayedMs(-1L).build(), Instant.EPOCH))
                .isInstanceOf(EventValidationException.class)
                .satisfies(e -> assertThat(((EventValidationException) e).getField()).isEqualTo("duration_played_ms"));
    }
}
