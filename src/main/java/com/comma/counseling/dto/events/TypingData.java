package com.comma.counseling.dto.events;

import com.comma.counseling.models.ParticipantKind;
import lombok.Value;

import java.util.UUID;

@Value
public class TypingData {
    UUID userId;
    ParticipantKind userType;
    Boolean isTyping;
}
