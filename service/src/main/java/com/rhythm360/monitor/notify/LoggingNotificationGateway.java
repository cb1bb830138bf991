package com.rhythm360.monitor.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingNotificationGateway implements NotificationGateway {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationGateway.class);

  @Override
  public void dispatch(String title, String body, NotificationUrgency urgency) {
    log.info("Notification [{}] {}: {}", urgency, title, body);
  }
}
