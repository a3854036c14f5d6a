package com.example.equationreader.service.standardizer;

import java.util.Optional;

/**
 * Used when no standardizer service is configured.
 */
public class NoOpTextStandardizer implements TextStandardizer {

    @Override
    public Optional<String> standardize(String markup) {
        return Optional.empty();
    }
}
