package com.baykanat.musicstream.infrastructure.kafka;

import com.baykanat.musicstream.api.dto.PlayEventRequest;
import com.baykanat.musicstream.domain.mapper.PlayEventMapper;
import com.baykanat.musicstream.domain.model.IngestionSummary;
import com.baykanat.musicstream.domain.service.PlayEventIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** play-events topic'ten batch tüketir; PlayEventIngestionService ile aggregator'a uygular. Deserialize hataları DLT'ye. */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlayEventKafkaConsumer {

    /** ErrorHandlingDeserializer hata durumunda bu header'ı set eder; value null olur. */
    private static final String VALUE_DESERIALIZATION_EXCEPTION_HEADER =
            "springDeserializationValueException";

    private final PlayEventIngestionService ingestionService;
    private final PlayEventMapper playEventMapper;
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${app.kafka.topic.play-events}")
    private String playEventsTopic;

    @KafkaListener(
            topics = "${app.kafka.topic.play-events}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, Object>> records, Acknowledgment acknowledgment) {
        log.debug("Received batch of {} records from play-events topic", records.size());

        List<PlayEventRequest> events = new ArrayList<>(records.size());
        int dltCount = 0;

        for (ConsumerRecord<String, Object> record : records) {
            if (hasDeserializationError(record)) {
                log.error("Kafka deserialization failed for record at offset={}, partition={}",
                        record.offset(), record.partition());
                publishToDlt(record, "Kafka-level deserialization failure");
                dltCount++;
                continue;
            }

            try {
                PlayEventRequest event = playEventMapper.fromRecordValue(record.value());
                if (event != null) {
                    events.add(event);
                }
            } catch (Exception e) {
                log.error("Failed to deserialize record at offset={}, partition={}: {}",
                        record.offset(), record.partition(), e.getMessage());
                publishToDlt(record, e.getMessage());
                dltCount++;
            }
        }

        if (!events.isEmpty()) {
            IngestionSummary summary = ingestionService.processBatch(events);
            log.info("Batch consumed: {} records, {} processed ({} applied, {} duplicates, {} dropped late, {} invalid), {} sent to DLT",
                    records.size(), summary.total(), summary.getApplied(), summary.getDuplicates(),
                    summary.getDroppedLate(), summary.getInvalid(), dltCount);
        } else if (dltCount > 0) {
            log.warn("All {} records in batch failed deserialization, {} sent to DLT", records.size(), dltCount);
        }

        acknowledgment.acknowledge();
    }

    private boolean hasDeserializationError(ConsumerRecord<String, Object> record) {
        Headers headers = record.headers();
        return headers.lastHeader(VALUE_DESERIALIZATION_EXCEPTION_HEADER) != null;
    }

    /** Başarısız kaydı DLT'ye gönderir. DLT gönderimi hata verirse loglanır, batch devam eder. */
    private void publishToDlt(ConsumerRecord<String, Object> record, String reason) {
        String topic = Objects.requireNonNull(playEventsTopic, "playEventsTopic") + ".DLT";
        try {
            String key = Objects.requireNonNullElse(record.key(), "");
            kafkaTemplate.send(topic, key, record.value());
            log.warn("Sent failed record to DLT: topic={}, offset={}, partition={}, reason={}",
                    topic, record.offset(), record.partition(), Objects.requireNonNullElse(reason, ""));
        } catch (Exception dltEx) {
            log.error("Failed to publish record to DLT {}: {}", topic, dltEx.getMessage(), dltEx);
        }
    }
}
