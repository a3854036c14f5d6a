package com.example.equationreader.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * The recognizer failed while processing an image.
 */
public class RecognitionFailureException extends EquationReaderException {

    private static final List<String> IMAGE_LIBRARY_SIGNATURES =
            List.of("cvtColor", "cv2", "_src.empty()", "Invalid memory access");

    public RecognitionFailureException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public RecognitionFailureException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }

    /**
     * Wraps a recognizer failure, rewording image-library assertion failures into a message a
     * client can act on.
     */
    public static RecognitionFailureException from(Throwable cause) {
        String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        boolean imageLibraryFailure = IMAGE_LIBRARY_SIGNATURES.stream().anyMatch(detail::contains);
        if (imageLibraryFailure) {
            return new RecognitionFailureException(
                    "Image processing failed: the image appears to be corrupted or in an unsupported format", cause);
        }
        return new RecognitionFailureException("Recognition failed: " + detail, cause);
    }
}
