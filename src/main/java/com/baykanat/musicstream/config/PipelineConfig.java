package com.baykanat.musicstream.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/** Pipeline bean'leri: saat, model çağrıları için executor ve RestClient. */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Model skorlama çağrıları; her çağrı timeout ile sınırlı, kuyruk dolunca caller thread'de çalışmaz, reddedilir. */
    @Bean(name = "scoringExecutor")
    public ThreadPoolTaskExecutor scoringExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("model-score-");
        executor.initialize();
        return executor;
    }

    @Bean
    public RestClient scoringRestClient(RestClient.Builder builder, AppProperties appProperties) {
        Duration timeout = appProperties.getRecommendation().getModelTimeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return builder
                .baseUrl(appProperties.getModel().getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
