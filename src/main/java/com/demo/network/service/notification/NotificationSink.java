package com.demo.network.service.notification;

import com.demo.network.model.Notification;

/** Outbound delivery. Fire-and-forget: callers never wait for or depend on confirmation. */
public interface NotificationSink {

    void send(Notification notification);
}
