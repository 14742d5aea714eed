package com.comma.counseling.exceptions;

public class ValidationException extends CounselingException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "VALIDATION_ERROR";
    }
}
