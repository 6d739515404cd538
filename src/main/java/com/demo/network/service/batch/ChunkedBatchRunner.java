package com.demo.network.service.batch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Splits a batch into fixed-size chunks and commits each chunk in its own transaction.
 * A failing chunk is rolled back, recorded and skipped; the remaining chunks still run.
 */
@Slf4j
@Component
public class ChunkedBatchRunner {

    private final TransactionOperations tx;
    private final Clock clock;

    public ChunkedBatchRunner(TransactionOperations tx, Clock clock) {
        this.tx = tx;
        this.clock = clock;
    }

    public <T> BatchResult run(String job, String accountId, List<T> items, int chunkSize,
                               Function<T, String> idOf, BiConsumer<List<T>, ChunkOutcome> work) {
        Instant started = clock.instant();
        int size = Math.max(1, chunkSize);
        int succeeded = 0;
        int failed = 0;
        int created = 0;
        boolean truncated = false;
        List<ChunkError> errors = new ArrayList<>();

        for (int from = 0, index = 0; from < items.size(); from += size, index++) {
            List<T> chunk = items.subList(from, Math.min(items.size(), from + size));
            ChunkOutcome outcome = new ChunkOutcome();
            try {
                tx.executeWithoutResult(status -> work.accept(chunk, outcome));
                succeeded += chunk.size();
                created += outcome.created();
                truncated |= outcome.isIncomplete();
                for (String note : outcome.notes()) {
                    errors.add(new ChunkError(index, List.of(), note));
                }
            } catch (RuntimeException ex) {
                failed += chunk.size();
                List<String> ids = chunk.stream().map(idOf).toList();
                errors.add(new ChunkError(index, ids, ex.getMessage() == null ? ex.toString() : ex.getMessage()));
                log.warn("{} chunk {} for account {} failed ({} items): {}", job, index, accountId, chunk.size(), ex.toString());
            }
        }

        BatchStatus status = failed == 0 && !truncated ? BatchStatus.COMPLETED : BatchStatus.PARTIAL;
        BatchResult result = new BatchResult(job, accountId, status, succeeded + failed, succeeded, failed,
                created, errors, started, clock.instant());
        log.info("{} for account {} finished: status={} processed={} failed={} created={}",
                job, accountId, status, result.processed(), failed, created);
        return result;
    }
}
