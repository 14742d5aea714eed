package com.comma.counseling.security;

import com.comma.counseling.models.ParticipantKind;
import lombok.Value;

import java.util.UUID;

/**
 * A resolved, active identity allowed to take part in counseling sessions.
 */
@Value
public class AuthenticatedParticipant {
    UUID id;
    ParticipantKind kind;
    String displayName;

    public boolean isCounselor() {
        return kind == ParticipantKind.COUNSELOR;
    }
}
