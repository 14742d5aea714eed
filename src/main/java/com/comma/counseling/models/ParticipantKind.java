package com.comma.counseling.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ParticipantKind {
    USER,
    COUNSELOR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ParticipantKind fromCode(String code) {
        return ParticipantKind.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
