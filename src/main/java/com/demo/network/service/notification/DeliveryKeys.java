package com.demo.network.service.notification;

import java.time.LocalDate;

/** Key spaces of the delivery log. Each is recorded once per user. */
public final class DeliveryKeys {

    private DeliveryKeys() {
    }

    public static String alert(String opportunityId) {
        return "alert:" + opportunityId;
    }

    public static String expiring(String opportunityId) {
        return "expiring:" + opportunityId;
    }

    /** UTC calendar day. */
    public static String digest(LocalDate day) {
        return "digest:" + day;
    }
}
