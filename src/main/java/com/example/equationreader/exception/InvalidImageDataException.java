package com.example.equationreader.exception;

import org.springframework.http.HttpStatus;

/**
 * The submitted bytes are not a decodable image.
 */
public class InvalidImageDataException extends EquationReaderException {

    public InvalidImageDataException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public InvalidImageDataException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, cause);
    }
}
