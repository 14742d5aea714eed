package com.comma.counseling.exceptions;

public class InvalidCredentialException extends CounselingException {

    public InvalidCredentialException(String message) {
        super(message);
    }

    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "AUTHENTICATION_ERROR";
    }
}
