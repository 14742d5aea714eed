package com.comma.counseling.dto.events;

import com.comma.counseling.models.ParticipantKind;
import lombok.Value;

import java.util.UUID;

/**
 * Payload of {@code user_joined} and {@code user_left}.
 */
@Value
public class PresenceData {
    UUID userId;
    ParticipantKind userType;
    String message;
}
