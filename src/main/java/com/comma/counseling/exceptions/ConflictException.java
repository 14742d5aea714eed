package com.comma.counseling.exceptions;

public class ConflictException extends CounselingException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "CONFLICT";
    }
}
