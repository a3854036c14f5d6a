package com.example.equationreader.exception;

import org.springframework.http.HttpStatus;

/**
 * A recognition arrived before the model finished loading, or after loading failed.
 */
public class ModelNotReadyException extends EquationReaderException {

    public ModelNotReadyException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
    }

    public ModelNotReadyException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
