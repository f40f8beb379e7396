package com.baykanat.musicstream.scheduler;

import com.baykanat.musicstream.domain.exception.WindowRollException;
import com.baykanat.musicstream.domain.model.RollResult;
import com.baykanat.musicstream.domain.service.WindowedAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** Allowed lateness'ı geçen bucket'ları periyodik finalize eder (varsayılan dakikada bir). */
@Slf4j
@Component
@RequiredArgsConstructor
public class WindowRollScheduler {

    private final WindowedAggregator aggregator;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${app.scheduler.window-roll-rate:60000}",
            initialDelayString = "${app.scheduler.window-roll-initial-delay:10000}"
    )
    public void roll() {
        try {
            RollResult result = aggregator.rollWindow(clock.instant());
            if (result.getFinalizedBuckets() > 0) {
                log.info("Window roll: finalized {} bucket(s), persisted {}, pruned {}",
                        result.getFinalizedBuckets(), result.getPersistedBuckets(), result.getPrunedBuckets());
            } else {
                log.debug("Window roll: nothing to finalize");
            }
        } catch (WindowRollException e) {
            log.warn("Window roll incomplete, pending buckets retried next cycle: {} ({})",
                    e.getMessage(), e.getContext());
        } catch (Exception e) {
            log.error("Failed to roll windows: {}", e.getMessage(), e);
        }
    }
}
