package com.demo.network.service.batch;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one batch per account at a time. Different accounts never block each other;
 * a second trigger for a busy account is refused instead of queued.
 */
@Component
public class AccountBatchGuard {

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public Optional<Permit> tryAcquire(String accountId) {
        if (!running.add(accountId)) {
            return Optional.empty();
        }
        return Optional.of(new Permit(accountId));
    }

    public boolean isRunning(String accountId) {
        return running.contains(accountId);
    }

    public final class Permit implements AutoCloseable {
        private final String accountId;
        private boolean released;

        private Permit(String accountId) {
            this.accountId = accountId;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                running.remove(accountId);
            }
        }
    }
}
