package com.demo.network.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI networkOpenAPI(@Value("${network.scoring.weights-version:unversioned}") String weightsVersion) {
        return new OpenAPI()
                .info(new Info()
                        .title("Network Opportunity API")
                        .description("Relationship discovery, contact scoring, opportunity lifecycle, "
                                + "feedback and notification settings. Scoring weights: " + weightsVersion)
                        .version("v1"))
                .tags(List.of(
                        new Tag().name("discovery").description("Inferred relationships awaiting review"),
                        new Tag().name("scoring").description("Priority, opportunity and strategic scores"),
                        new Tag().name("opportunities").description("Suggestions, status, feedback and metrics"),
                        new Tag().name("batch").description("Per-account batch triggers"),
                        new Tag().name("notifications").description("Per-user delivery settings")));
    }
}
