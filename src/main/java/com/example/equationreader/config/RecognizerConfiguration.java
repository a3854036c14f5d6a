package com.example.equationreader.config;

import com.example.equationreader.service.ocr.EquationRecognizer;
import com.example.equationreader.service.ocr.LatexOcrRemoteRecognizer;
import com.example.equationreader.service.ocr.TesseractEquationRecognizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the {@link EquationRecognizer} named by {@code equation-reader.ocr.engine}.
 */
@Configuration
public class RecognizerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RecognizerConfiguration.class);

    @Bean
    public EquationRecognizer equationRecognizer(EquationReaderProperties properties,
                                                 RestTemplateBuilder restTemplateBuilder,
                                                 ObjectMapper objectMapper) {
        EquationReaderProperties.Ocr ocr = properties.getOcr();
        String engine = ocr.getEngine() == null ? "" : ocr.getEngine().trim().toLowerCase(Locale.ROOT);
        switch (engine) {
            case "remote" -> {
                log.info("Using LaTeX-OCR server at {}", ocr.getRemote().getBaseUrl());
                return new LatexOcrRemoteRecognizer(restTemplateBuilder
                        .rootUri(ocr.getRemote().getBaseUrl())
                        .setConnectTimeout(ocr.getRemote().getConnectTimeout())
                        .setReadTimeout(ocr.getTimeout())
                        .build(), objectMapper);
            }
            case "tesseract" -> {
                log.info("Using local Tesseract recognizer. Expect plain infix output rather than LaTeX.");
                return new TesseractEquationRecognizer(ocr.getTesseract());
            }
            default -> throw new IllegalStateException(
                    "Unknown equation-reader.ocr.engine '" + ocr.getEngine() + "', expected 'remote' or 'tesseract'");
        }
    }
}
