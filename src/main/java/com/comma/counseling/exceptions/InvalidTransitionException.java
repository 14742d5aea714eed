package com.comma.counseling.exceptions;

import com.comma.counseling.models.SessionStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * Raised when the session state machine rejects a move, either because the
 * session was read in the wrong state or because another actor won the
 * conditional update first.
 */
@Getter
public class InvalidTransitionException extends CounselingException {

    private final UUID sessionId;
    private final SessionStatus currentStatus;

    public InvalidTransitionException(UUID sessionId, SessionStatus currentStatus, String action) {
        super("Cannot " + action + " session with status: "
                + (currentStatus == null ? "unknown" : currentStatus.code()));
        this.sessionId = sessionId;
        this.currentStatus = currentStatus;
    }

    @Override
    public String getCode() {
        return "INVALID_TRANSITION";
    }
}
