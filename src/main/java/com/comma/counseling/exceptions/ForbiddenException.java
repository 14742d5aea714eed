package com.comma.counseling.exceptions;

public class ForbiddenException extends CounselingException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "FORBIDDEN";
    }
}
