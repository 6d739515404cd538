package com.demo.network.config;

import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${app.cors.allowed-origins:}")
    private String corsOrigins;

    @Value("${app.cors.max-age-seconds:1800}")
    private long maxAgeSeconds;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = origins();

        // batch triggers are POST only; everything else under /api is the UI surface
        CorsRegistration batch = registry.addMapping("/api/accounts/*/batch/**")
                .allowedMethods("POST", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(maxAgeSeconds);
        CorsRegistration api = registry.addMapping("/api/**")
                .allowedMethods("GET", "POST", "PUT", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(maxAgeSeconds);
        CorsRegistration docs = registry.addMapping("/v3/api-docs/**")
                .allowedMethods("GET");

        if (origins.length > 0) {
            batch.allowedOrigins(origins).allowCredentials(true);
            api.allowedOrigins(origins).allowCredentials(true);
            docs.allowedOrigins(origins);
        }
    }

    private String[] origins() {
        if (!StringUtils.hasText(corsOrigins)) return new String[0];
        return Arrays.stream(corsOrigins.split(","))
                .map(String::trim).filter(s -> !s.isEmpty()).toArray(String[]::new);
    }
}
