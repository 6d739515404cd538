package com.demo.network.repository;

import java.time.Instant;

/** Remembers which (user, delivery key) pairs were already sent. */
public interface NotificationLogRepository {

    boolean wasSent(String userId, String deliveryKey);

    /** Returns false when the key had already been recorded. */
    boolean markSent(String userId, String deliveryKey, Instant sentAt);
}
