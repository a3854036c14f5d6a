package com.example.equationreader.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class of the failures a client can see. Each subclass fixes the HTTP status it maps to.
 */
public abstract class EquationReaderException extends RuntimeException {

    private final HttpStatus status;

    protected EquationReaderException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected EquationReaderException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
