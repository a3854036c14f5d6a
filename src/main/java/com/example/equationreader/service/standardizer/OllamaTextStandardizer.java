package com.example.equationreader.service.standardizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Asks a local Ollama model to rewrite recognizer markup as standard LaTeX through the
 * non-streaming {@code /api/generate} endpoint.
 */
public class OllamaTextStandardizer implements TextStandardizer {

    private static final Logger log = LoggerFactory.getLogger(OllamaTextStandardizer.class);

    private static final String PROMPT =
            "Rewrite the following OCR output of a single math equation as clean, standard LaTeX. "
                    + "Fix obvious recognition mistakes, keep the mathematics unchanged, and answer with the "
                    + "LaTeX only: no explanation, no dollar signs, no code fences.\n\nOCR output: %s";
    private static final Pattern CODE_FENCE = Pattern.compile("^```[A-Za-z]*\\s*|\\s*```$");

    private final RestTemplate restTemplate;
    private final String model;

    public OllamaTextStandardizer(RestTemplate restTemplate, String model) {
        this.restTemplate = restTemplate;
        this.model = model;
    }

    @Override
    public Optional<String> standardize(String markup) {
        if (markup == null || markup.isBlank()) {
            return Optional.empty();
        }
        Map<String, Object> request = Map.of(
                "model", model,
                "prompt", String.format(PROMPT, markup),
                "stream", false);
        try {
            Map<?, ?> response = restTemplate.postForObject("/api/generate", request, Map.class);
            Object text = response == null ? null : response.get("response");
            if (!(text instanceof String answer)) {
                log.warn("Standardizer returned no text for '{}'", markup);
                return Optional.empty();
            }
            String cleaned = CODE_FENCE.matcher(answer.strip()).replaceAll("").replace("$", "").strip();
            return cleaned.isEmpty() ? Optional.empty() : Optional.of(cleaned);
        } catch (RestClientException ex) {
            log.warn("Standardizer unavailable, continuing with rule based correction: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
