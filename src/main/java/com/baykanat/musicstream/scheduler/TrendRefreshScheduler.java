package com.baykanat.musicstream.scheduler;

import com.baykanat.musicstream.config.AppProperties;
import com.baykanat.musicstream.domain.exception.InsufficientDataException;
import com.baykanat.musicstream.domain.model.EntityType;
import com.baykanat.musicstream.domain.model.TrendRanking;
import com.baykanat.musicstream.domain.service.TrendRanker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/** Varsayılan lookback için trend sıralamasını yeniden hesaplayıp trend_scores tablosuna yazar (varsayılan 5 dk). */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrendRefreshScheduler {

    private final TrendRanker trendRanker;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${app.scheduler.trend-refresh-rate:300000}",
            initialDelayString = "60000"
    )
    public void refreshTrends() {
        AppProperties.TrendProperties props = appProperties.getTrend();
        Instant now = clock.instant();
        for (EntityType type : EntityType.values()) {
            if (type.isProfileDimension()) {
                continue;
            }
            try {
                TrendRanking ranking = trendRanker.refresh(type, props.getDefaultLookbackDays(), props.getDefaultLimit(), now);
                log.debug("Trend refresh: {} entries for {}", ranking.getScores().size(), type);
            } catch (InsufficientDataException e) {
                log.debug("Trend refresh skipped for {}: {}", type, e.getMessage());
            } catch (Exception e) {
                log.error("Failed to refresh trends for {}: {}", type, e.getMessage(), e);
            }
        }
    }
}
