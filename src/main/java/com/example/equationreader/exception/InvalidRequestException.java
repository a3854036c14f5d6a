package com.example.equationreader.exception;

import org.springframework.http.HttpStatus;

/**
 * A required request field is missing or malformed.
 */
public class InvalidRequestException extends EquationReaderException {

    public InvalidRequestException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, cause);
    }
}
