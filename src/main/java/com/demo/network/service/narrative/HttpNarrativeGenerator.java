package com.demo.network.service.narrative;

import com.demo.network.config.NetworkProperties;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/** Calls {@code POST {base-url}/summarize}. A blank base URL disables the call. */
@Slf4j
@Component
public class HttpNarrativeGenerator implements NarrativeGenerator {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpNarrativeGenerator(@Qualifier("narrativeRestTemplate") RestTemplate restTemplate,
                                  NetworkProperties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = properties.getNarrative().getBaseUrl();
    }

    /**
     * Expects JSON {@code {"text": "..."}}. Timeouts, non-2xx answers and empty text all
     * yield {@link Optional#empty()} so the template description is kept.
     */
    @Override
    public Optional<String> summarize(String prompt) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return Optional.empty();
        }
        try {
            var req = RequestEntity
                    .post(URI.create(baseUrl + "/summarize"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("prompt", prompt));
            ResponseEntity<SummaryResult> resp = restTemplate.exchange(req, SummaryResult.class);
            SummaryResult body = resp.getBody();
            if (body == null || body.getText() == null || body.getText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(body.getText().trim());
        } catch (Exception ex) {
            log.warn("Narrative summarize failed, keeping template text: {}", ex.toString());
            return Optional.empty();
        }
    }

    @Data
    public static class SummaryResult {
        private String text;
    }
}
