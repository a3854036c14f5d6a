package com.example.equationreader.service.ocr;

import java.awt.image.BufferedImage;

/**
 * Turns an equation image into raw LaTeX markup. Implementations are loaded once by
 * {@link RecognitionModelHolder} and may be slow or blocking; they are always called from the
 * holder's worker pool under a deadline.
 */
public interface EquationRecognizer {

    /**
     * Short name reported by the health endpoint.
     */
    String engineName();

    /**
     * Prepares the underlying model. Called once before the first recognition.
     *
     * @throws IllegalStateException when the model cannot be made ready
     */
    void load();

    /**
     * @param image opaque RGB image
     * @return raw markup, possibly blank when nothing was recognized
     */
    String recognize(BufferedImage image);
}
