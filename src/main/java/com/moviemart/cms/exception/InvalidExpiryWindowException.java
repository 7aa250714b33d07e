package com.moviemart.cms.exception;

public class InvalidExpiryWindowException extends RuntimeException {

    public InvalidExpiryWindowException(String message) {
        super(message);
    }

    public InvalidExpiryWindowException(String message, Throwable cause) {
        super(message, cause);
    }
}
