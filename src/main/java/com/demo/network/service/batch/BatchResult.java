package com.demo.network.service.batch;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a batch entry point. {@code processed = succeeded + failed} counts items;
 * {@code created} counts rows the batch produced (candidates, suggestions, notifications).
 */
public record BatchResult(
        String job,
        String accountId,
        BatchStatus status,
        int processed,
        int succeeded,
        int failed,
        int created,
        List<ChunkError> errors,
        Instant startedAt,
        Instant finishedAt
) {

    public BatchResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BatchResult rejected(String job, String accountId, Instant at) {
        return new BatchResult(job, accountId, BatchStatus.REJECTED, 0, 0, 0, 0,
                List.of(new ChunkError(-1, List.of(), "A " + job + " batch is already running for account " + accountId)),
                at, at);
    }
}
