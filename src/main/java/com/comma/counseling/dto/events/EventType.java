package com.comma.counseling.dto.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventType {
    SESSION_INFO,
    NEW_MESSAGE,
    USER_JOINED,
    USER_LEFT,
    TYPING_INDICATOR,
    SESSION_STARTED,
    SESSION_ENDED,
    ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
