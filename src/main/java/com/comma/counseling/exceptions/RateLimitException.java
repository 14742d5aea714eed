package com.comma.counseling.exceptions;

public class RateLimitException extends CounselingException {

    public RateLimitException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "RATE_LIMITED";
    }
}
