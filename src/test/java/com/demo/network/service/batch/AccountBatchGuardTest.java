package com.demo.network.service.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AccountBatchGuard")
class AccountBatchGuardTest {

    private final AccountBatchGuard guard = new AccountBatchGuard();

    @Test
    @DisplayName("second acquire for the same account is refused until the permit closes")
    void oneAtATime() {
        Optional<AccountBatchGuard.Permit> first = guard.tryAcquire("a");
        assertTrue(first.isPresent());
        assertTrue(guard.tryAcquire("a").isEmpty());
        assertTrue(guard.isRunning("a"));

        first.get().close();

        assertFalse(guard.isRunning("a"));
        assertTrue(guard.tryAcquire("a").isPresent());
    }

    @Test
    @DisplayName("accounts do not block each other")
    void independentAccounts() {
        assertTrue(guard.tryAcquire("a").isPresent());
        assertTrue(guard.tryAcquire("b").isPresent());
    }

    @Test
    @DisplayName("closing a permit twice does not release a newer holder")
    void doubleClose() {
        AccountBatchGuard.Permit first = guard.tryAcquire("a").orElseThrow();
        first.close();
        AccountBatchGuard.Permit second = guard.tryAcquire("a").orElseThrow();

        first.close();

        assertTrue(guard.isRunning("a"));
        second.close();
        assertFalse(guard.isRunning("a"));
    }
}
