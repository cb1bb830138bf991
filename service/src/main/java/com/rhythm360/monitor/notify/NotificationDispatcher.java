package com.rhythm360.monitor.notify;

import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget hand-off to the {@link NotificationGateway}. Delivery failures are logged and
 * dropped so a slow or broken gateway never stalls the monitoring session that raised the alert.
 */
@Service
public class NotificationDispatcher {
  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationGateway gateway;

  public NotificationDispatcher(NotificationGateway gateway) {
    this.gateway = gateway;
  }

  @Async
  public CompletableFuture<Void> dispatch(Notification notification) {
    try {
      gateway.dispatch(notification.title(), notification.body(), notification.urgency());
    } catch (RuntimeException ex) {
      log.warn("Dropping notification '{}' for device {}: {}", notification.title(),
          notification.deviceId(), ex.getMessage());
    }
    return CompletableFuture.completedFuture(null);
  }
}
