package com.example.equationreader.service;

import com.example.equationreader.config.EquationReaderProperties;
import com.example.equationreader.exception.EmptyRecognitionResultException;
import com.example.equationreader.exception.ImagePreprocessingException;
import com.example.equationreader.model.CanonicalResult;
import com.example.equationreader.model.RecognitionResponse;
import com.example.equationreader.service.ocr.RecognitionModelHolder;
import com.example.equationreader.service.pipeline.CanonicalizationOutcome;
import com.example.equationreader.service.pipeline.TieredCanonicalizer;
import com.example.equationreader.service.standardizer.TextStandardizer;
import com.example.equationreader.util.ConfidenceEstimator;
import com.example.equationreader.util.ImagePreprocessor;
import com.example.equationreader.util.StructuralCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Recognition entry point: image preparation, the OCR model, then the text pipeline
 * (structural cleaning, optional standardization, tiered canonicalization, confidence).
 */
@Service
public class EquationRecognitionService {

    private static final Logger log = LoggerFactory.getLogger(EquationRecognitionService.class);

    private final RecognitionModelHolder modelHolder;
    private final TieredCanonicalizer canonicalizer;
    private final TextStandardizer standardizer;
    private final double standardizerTrustScore;

    public EquationRecognitionService(RecognitionModelHolder modelHolder,
                                      TieredCanonicalizer canonicalizer,
                                      TextStandardizer standardizer,
                                      EquationReaderProperties properties) {
        this.modelHolder = modelHolder;
        this.canonicalizer = canonicalizer;
        this.standardizer = standardizer;
        this.standardizerTrustScore = properties.getStandardizer().getTrustScore();
    }

    public RecognitionResponse recognize(BufferedImage image) {
        long started = System.nanoTime();
        BufferedImage prepared;
        try {
            prepared = ImagePreprocessor.prepareForOcr(image);
        } catch (IllegalArgumentException ex) {
            throw new ImagePreprocessingException("Image preprocessing failed: " + ex.getMessage(), ex);
        }

        String markup = modelHolder.recognize(prepared);
        if (markup == null || markup.isBlank()) {
            throw new EmptyRecognitionResultException("OCR returned empty result");
        }
        log.debug("Recognizer returned '{}'", markup);

        CanonicalResult result = canonicalize(markup);
        double elapsedMs = (System.nanoTime() - started) / 1_000_000.0;
        return RecognitionResponse.of(result, ConfidenceEstimator.round(elapsedMs));
    }

    /**
     * Runs the text pipeline alone. Never throws for bad markup: unparseable input comes back
     * with {@code validated = false}.
     */
    public CanonicalResult canonicalize(String markup) {
        String cleaned = StructuralCleaner.clean(markup);
        Optional<String> standardized = standardizer.standardize(cleaned);
        CanonicalizationOutcome outcome = canonicalizer.canonicalize(cleaned, standardized.orElse(null));

        double base = standardized.isPresent() ? standardizerTrustScore : ConfidenceEstimator.estimate(cleaned);
        double confidence = ConfidenceEstimator.round(ConfidenceEstimator.adjustForValidation(base, outcome.validated()));
        String tier = outcome.tier() == null ? null : outcome.tier().label();

        log.debug("Canonicalized '{}' to '{}' (validated={}, tier={}, confidence={})",
                cleaned, outcome.expression(), outcome.validated(), tier, confidence);

        return new CanonicalResult(
                outcome.expression(),
                cleaned,
                outcome.expression(),
                outcome.rawExpression(),
                outcome.refinedExpression(),
                outcome.validated(),
                confidence,
                tier,
                standardized.isPresent());
    }
}
