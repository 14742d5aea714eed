package com.comma.counseling.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static SessionStatus fromCode(String code) {
        return SessionStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
