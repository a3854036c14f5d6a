package com.example.equationreader.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "LaTeX markup to repair and validate")
public record CanonicalizeRequest(
        @NotBlank(message = "Missing 'latex' field in request body")
        @Schema(description = "Markup as produced by an equation recognizer", example = "\\sin(x)**2 + \\cos(x)**2 - 1")
        String latex) {
}
