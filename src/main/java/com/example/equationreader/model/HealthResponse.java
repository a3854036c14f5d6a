package com.example.equationreader.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
        String status,
        String service,
        @JsonProperty("model_loaded") boolean modelLoaded,
        String engine,
        @JsonProperty("load_error") String loadError,
        @JsonProperty("ocr_concurrency") int ocrConcurrency) {
}
