package com.example.equationreader.exception;

import org.springframework.http.HttpStatus;

/**
 * Recognition exceeded its deadline. Retryable.
 */
public class RecognitionTimeoutException extends EquationReaderException {

    public RecognitionTimeoutException(String message) {
        super(HttpStatus.GATEWAY_TIMEOUT, message);
    }

    public RecognitionTimeoutException(String message, Throwable cause) {
        super(HttpStatus.GATEWAY_TIMEOUT, message, cause);
    }
}
