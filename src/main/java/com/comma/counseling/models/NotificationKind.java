package com.comma.counseling.models;

import java.util.Locale;

public enum NotificationKind {
    SESSION_BOOKED,
    SESSION_REMINDER,
    SESSION_STARTED,
    SESSION_COMPLETED,
    SESSION_CANCELLED;

    public String routingKey() {
        return "notification." + name().toLowerCase(Locale.ROOT);
    }
}
