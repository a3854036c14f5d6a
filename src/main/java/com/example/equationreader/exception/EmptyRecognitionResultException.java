package com.example.equationreader.exception;

import org.springframework.http.HttpStatus;

/**
 * The recognizer ran but produced no markup.
 */
public class EmptyRecognitionResultException extends EquationReaderException {

    public EmptyRecognitionResultException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public EmptyRecognitionResultException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, cause);
    }
}
