package com.example.equationreader.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Recognized and canonicalized equation")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecognitionResponse(
        @Schema(description = "Canonical expression when validated, otherwise the best-effort cleaned markup")
        String expression,
        @Schema(description = "Cleaned LaTeX markup")
        String latex,
        @JsonProperty("canonical_expression")
        String canonicalExpression,
        @JsonProperty("refined_expression")
        String refinedExpression,
        @JsonProperty("raw_expression")
        String rawExpression,
        @Schema(description = "True when a parser accepted the expression")
        boolean validated,
        @Schema(description = "Heuristic confidence between 0 and 1")
        double confidence,
        @JsonProperty("processing_time_ms")
        Double processingTimeMs,
        @JsonProperty("llm_used")
        Boolean llmUsed,
        @Schema(description = "Validation tier that accepted the expression")
        String tier) {

    public static RecognitionResponse of(CanonicalResult result, Double processingTimeMs) {
        return new RecognitionResponse(
                result.expression(),
                result.latex(),
                result.canonicalExpression(),
                result.refinedExpression(),
                result.rawExpression(),
                result.validated(),
                result.confidence(),
                processingTimeMs,
                result.llmUsed(),
                result.tier());
    }
}
