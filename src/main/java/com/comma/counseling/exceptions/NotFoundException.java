package com.comma.counseling.exceptions;

public class NotFoundException extends CounselingException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String resourceType, Object identifier) {
        super(String.format("%s not found: %s", resourceType, identifier));
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
