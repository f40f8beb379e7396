package com.baykanat.musicstream.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.util.Objects;

/** play-events ve DLT topic bean'leri. Partition key user_id; aynı kullanıcının event'leri sıralı gelir. */
@Configuration
public class KafkaProducerConfig {

    @Value("${app.kafka.topic.play-events}")
    private String playEventsTopic;

    @Bean
    public NewTopic playEventsTopic() {
        return TopicBuilder.name(Objects.requireNonNull(playEventsTopic, "playEventsTopic"))
                .partitions(6)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic playEventsDlt() {
        return TopicBuilder.name(Objects.requireNonNull(playEventsTopic, "playEventsTopic") + ".DLT")
                .partitions(3)
                .replicas(1)
                .build();
    }
}
