package com.baykanat.musicstream.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI musicStreamOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Music Stream Pipeline - Listening Aggregation & Recommendation API")
                        .description("""
                                Ingests play events via HTTP and Kafka, aggregates them into time-window \
                                buckets per user, artist, genre and track, and serves trend rankings and \
                                model-scored track recommendations from finalized aggregates.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
