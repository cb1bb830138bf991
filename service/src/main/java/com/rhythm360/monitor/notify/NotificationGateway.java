package com.rhythm360.monitor.notify;

/** Delivery boundary for user-facing notifications (push, SMS, ...). */
public interface NotificationGateway {

  void dispatch(String title, String body, NotificationUrgency urgency);
}
