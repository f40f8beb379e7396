package com.baykanat.musicstream.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** app.* için tip güvenli configuration (topic adları, pencere boyutları, trend ağırlıkları, model timeout, scheduler aralıkları). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private KafkaTopicProperties kafka = new KafkaTopicProperties();
    private AggregationProperties aggregation = new AggregationProperties();
    private TrendProperties trend = new TrendProperties();
    private RecommendationProperties recommendation = new RecommendationProperties();
    private ModelProperties model = new ModelProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String playEvents = "play-events";
        }
    }

    @Getter
    @Setter
    public static class AggregationProperties {
        /** Bucket granülaritesi; bucket'lar bu aralığa hizalı ve örtüşmez. */
        private Duration slideInterval = Duration.ofHours(1);
        /** Sliding görünüm uzunluğu; slideInterval'in katı olmalı (eşitse tumbling). */
        private Duration windowSize = Duration.ofHours(1);
        /** Bucket kapandıktan sonra finalize öncesi late event için bekleme süresi. */
        private Duration allowedLateness = Duration.ofMinutes(5);
        /** Finalize edilmiş bucket'ların bellekte ve storage'da tutulma süresi. */
        private Duration retention = Duration.ofDays(60);
        /** Gelecekteki timestamp için tolerans; daha ilerisi reddedilir. */
        private Duration maxClockSkew = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class TrendProperties {
        private double growthWeight = 0.7;
        private double volumeWeight = 0.3;
        /** Büyüme oranının paydası için alt sınır; küçük örneklem gürültüsünü bastırır. */
        private long volumeFloor = 10;
        private int defaultLookbackDays = 7;
        private int defaultLimit = 20;
    }

    @Getter
    @Setter
    public static class RecommendationProperties {
        /** Bu süre içinde dinlenen parçalar önerilmez. */
        private Duration exclusionWindow = Duration.ofDays(7);
        private Duration modelTimeout = Duration.ofMillis(500);
        private int candidateLimit = 200;
        private int defaultLimit = 20;
        private int profileLookbackDays = 30;
        /** Aday üretiminde kullanılan en çok dinlenen genre/artist sayısı. */
        private int topAffinities = 5;
        private int retryAfterSeconds = 10;
    }

    @Getter
    @Setter
    public static class ModelProperties {
        private String baseUrl = "http://localhost:8090";
        private String scorePath = "/v1/score";
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        /** Window roll aralığı (ms). */
        private long windowRollRate = 60000;
        private long windowRollInitialDelay = 10000;
        private long trendRefreshRate = 300000;
        private long retentionCleanupRate = 3600000;
    }
}
