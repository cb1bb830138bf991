package com.rhythm360.monitor.notify;

public record Notification(String deviceId, String title, String body, NotificationUrgency urgency) {}
