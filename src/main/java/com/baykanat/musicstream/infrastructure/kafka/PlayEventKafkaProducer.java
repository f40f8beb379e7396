package com.baykanat.musicstream.infrastructure.kafka;

import com.baykanat.musicstream.api.dto.PlayEventRequest;
import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.service.IdempotencyService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Play event'leri Kafka'ya gönderir; Retry + Circuit Breaker. Partition key user_id.
 *
 * <p>event_id gelmeyen payload'lara id burada bir kez atanır; retry aynı nesneyi tekrar gönderdiği için
 * Kafka'ya düşen kopyalar aynı id'yi taşır ve aggregator'da tek sayılır.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlayEventKafkaProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;
    private final IdempotencyService idempotencyService;

    /** Tek event gönderir; ack beklenir (acks=all). Gönderilen event_id döner. */
    @Retry(name = "kafkaProducer")
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleCircuitBreakerOpen")
    public String send(PlayEventRequest event) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getPlayEvents());
        String eventId = resolveEventId(event);
        String key = Objects.requireNonNull(event.getUserId(), "userId");
        kafkaTemplate.send(topic, key, event).get(1, TimeUnit.SECONDS);
        log.debug("Play event sent: event_id={}, user_id={}", eventId, key);
        return eventId;
    }

    /**
     * Toplu event'leri paralel gönderir; tüm ack'ler birlikte beklenir. Aynı istekte tekrarlanan event_id'ler
     * bir kez gönderilir. Gönderilen event sayısı döner.
     */
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleBatchCircuitBreakerOpen")
    public int sendBatch(List<PlayEventRequest> events) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getPlayEvents());

        Set<String> seen = new HashSet<>();
        List<PlayEventRequest> distinct = new ArrayList<>(events.size());
        for (PlayEventRequest event : events) {
            if (seen.add(resolveEventId(event))) {
                distinct.add(event);
            }
        }
        if (distinct.size() < events.size()) {
            log.debug("Skipped {} repeated event_id(s) in bulk request", events.size() - distinct.size());
        }

        List<CompletableFuture<SendResult<String, Object>>> futures = distinct.stream()
                .map(event -> kafkaTemplate.send(topic, Objects.requireNonNull(event.getUserId(), "userId"), event))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(10, TimeUnit.SECONDS);
        return distinct.size();
    }

    /** event_id yoksa payload'dan türetip event'e yazar; varsa trim'lenmiş hali kullanılır. */
    private String resolveEventId(PlayEventRequest event) {
        if (event.getEventId() == null || event.getEventId().isBlank()) {
            event.setEventId(idempotencyService.generateEventId(event));
        } else {
            event.setEventId(event.getEventId().trim());
        }
        return event.getEventId();
    }

    @SuppressWarnings("unused")
    private String handleCircuitBreakerOpen(PlayEventRequest event, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting play event event_id={}, user_id={}",
                event.getEventId(), event.getUserId());
        throw new ServiceUnavailableException(
                "Play event ingestion is temporarily unavailable. Kafka circuit breaker is open.", 30);
    }

    /** Tüm retry'lar tükendikten sonra fallback. */
    @SuppressWarnings("unused")
    private String handleCircuitBreakerOpen(PlayEventRequest event, Exception ex) {
        log.error("Kafka produce failed after all retries for event_id={}, user_id={}: {}",
                event.getEventId(), event.getUserId(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Play event ingestion is temporarily unavailable. " + ex.getMessage(), 30);
    }

    @SuppressWarnings("unused")
    private int handleBatchCircuitBreakerOpen(List<PlayEventRequest> events, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting batch of {} play events", events.size());
        throw new ServiceUnavailableException(
                "Play event ingestion is temporarily unavailable. Kafka circuit breaker is open.", 30);
    }

    @SuppressWarnings("unused")
    private int handleBatchCircuitBreakerOpen(List<PlayEventRequest> events, Exception ex) {
        log.error("Kafka batch produce failed for {} play events: {}", events.size(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Play event ingestion is temporarily unavailable. " + ex.getMessage(), 30);
    }

    /** Circuit breaker açık veya Kafka yok; GlobalExceptionHandler 503 + Retry-After döner. */
    public static class ServiceUnavailableException extends RuntimeException {
        private final int retryAfterSeconds;

        public ServiceUnavailableException(String message, int retryAfterSeconds) {
            super(message);
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}
