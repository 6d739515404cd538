package com.demo.network.service.narrative;

import java.util.Optional;

/**
 * Optional text summarizer used to enrich suggestion descriptions. Implementations must
 * return within their timeout and return empty instead of throwing.
 */
public interface NarrativeGenerator {

    Optional<String> summarize(String prompt);
}
