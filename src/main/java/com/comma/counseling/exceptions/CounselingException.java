package com.comma.counseling.exceptions;

/**
 * Base of every domain failure raised by the counseling core. Carries a stable
 * error code so REST and realtime callers can map it without instanceof chains.
 */
public abstract class CounselingException extends RuntimeException {

    protected CounselingException(String message) {
        super(message);
    }

    protected CounselingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
