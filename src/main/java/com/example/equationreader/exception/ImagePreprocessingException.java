package com.example.equationreader.exception;

import org.springframework.http.HttpStatus;

public class ImagePreprocessingException extends EquationReaderException {

    public ImagePreprocessingException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public ImagePreprocessingException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, cause);
    }
}
