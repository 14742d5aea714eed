package com.comma.counseling.exceptions;

public class UnavailableException extends CounselingException {

    public UnavailableException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "UNAVAILABLE";
    }
}
