package com.baykanat.musicstream.config;

import com.baykanat.musicstream.domain.model.AggregateRecord;
import com.baykanat.musicstream.domain.model.FinalizedBucket;
import com.baykanat.musicstream.domain.model.WindowBucket;
import com.baykanat.musicstream.domain.port.AggregateStore;
import com.baykanat.musicstream.domain.service.WindowedAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Açılışta retention aralığındaki finalize aggregate'leri storage'dan okuyup aggregator'a yükler. */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class AggregateWarmupRunner implements ApplicationRunner {

    private final AggregateStore aggregateStore;
    private final WindowedAggregator aggregator;
    private final AppProperties appProperties;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        Instant now = clock.instant();
        List<AggregateRecord> records = aggregateStore.scanRange(
                now.minus(appProperties.getAggregation().getRetention()), now);

        Map<WindowBucket, List<AggregateRecord>> byBucket = records.stream()
                .collect(Collectors.groupingBy(r -> r.getKey().getBucket(), TreeMap::new, Collectors.toList()));

        List<FinalizedBucket> buckets = byBucket.entrySet().stream()
                .map(e -> FinalizedBucket.of(e.getKey(), e.getValue()))
                .toList();

        aggregator.restore(buckets);
        log.info("Aggregate warm-up: restored {} finalized bucket(s), {} record(s)", buckets.size(), records.size());
    }
}
