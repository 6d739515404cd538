package com.demo.network.service.notification;

import com.demo.network.model.Notification;

import java.util.List;

/** A notification plus the delivery-log keys that must be recorded when it is sent. */
public record PlannedNotification(Notification notification, List<String> deliveryKeys) {

    public PlannedNotification {
        deliveryKeys = List.copyOf(deliveryKeys);
    }
}
