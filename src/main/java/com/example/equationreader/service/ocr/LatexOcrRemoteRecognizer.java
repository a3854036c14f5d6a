package com.example.equationreader.service.ocr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Delegates recognition to a LaTeX-OCR (pix2tex) API server. The server answers {@code GET /}
 * once its model is loaded and returns the markup for a multipart {@code file} posted to
 * {@code /predict/} as a JSON string.
 */
public class LatexOcrRemoteRecognizer implements EquationRecognizer {

    private static final Logger log = LoggerFactory.getLogger(LatexOcrRemoteRecognizer.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public LatexOcrRemoteRecognizer(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String engineName() {
        return "latex-ocr";
    }

    @Override
    public void load() {
        restTemplate.getForEntity("/", String.class);
        log.info("LaTeX-OCR server is reachable");
    }

    @Override
    public String recognize(BufferedImage image) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(encodePng(image)) {
            @Override
            public String getFilename() {
                return "equation.png";
            }
        });
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        String response = restTemplate.postForObject("/predict/", new HttpEntity<>(body, headers), String.class);
        return decode(response);
    }

    String decode(String response) {
        if (response == null) {
            return "";
        }
        String trimmed = response.strip();
        if (!trimmed.startsWith("\"")) {
            return trimmed;
        }
        try {
            return objectMapper.readValue(trimmed, String.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Malformed response from LaTeX-OCR server", ex);
        }
    }

    private static byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", output);
            return output.toByteArray();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to encode image as PNG", ex);
        }
    }
}
