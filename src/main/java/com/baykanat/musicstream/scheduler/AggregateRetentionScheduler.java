package com.baykanat.musicstream.scheduler;

import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.port.AggregateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/** aggregate_records tablosundan retention süresini aşan bucket'ları periyodik siler (varsayılan 60 gün). */
@Slf4j
@Component
@RequiredArgsConstructor
public class AggregateRetentionScheduler {

    private final AggregateStore aggregateStore;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${app.scheduler.retention-cleanup-rate:3600000}",
            initialDelayString = "60000"
    )
    public void cleanupExpiredAggregates() {
        try {
            Duration retention = appProperties.getAggregation().getRetention();
            int deleted = aggregateStore.deleteOlderThan(clock.instant().minus(retention));
            if (deleted > 0) {
                log.info("Aggregate cleanup: deleted {} records older than {}", deleted, retention);
            } else {
                log.debug("Aggregate cleanup: no records older than {} to delete", retention);
            }
        } catch (Exception e) {
            log.error("Failed to cleanup aggregate records: {}", e.getMessage(), e);
        }
    }
}
