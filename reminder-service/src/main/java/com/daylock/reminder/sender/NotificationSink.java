package com.daylock.reminder.sender;

import com.daylock.reminder.model.ReminderNotification;

/**
 * Delivery channel for reminder notifications. Implementations must not throw:
 * a failed delivery is logged and dropped.
 */
public interface NotificationSink {

    void send(ReminderNotification notification);
}
