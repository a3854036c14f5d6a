package com.example.equationreader.service.standardizer;

import java.util.Optional;

/**
 * Optional text-to-text rewrite of cleaned markup into standard LaTeX. Implementations never
 * throw: any failure is reported as an empty result and the pipeline carries on without it.
 */
public interface TextStandardizer {

    Optional<String> standardize(String markup);
}
