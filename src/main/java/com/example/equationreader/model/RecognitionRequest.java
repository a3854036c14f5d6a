package com.example.equationreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Equation image submitted as base64")
public record RecognitionRequest(
        @Schema(description = "Base64 encoded image, optionally as a data URL")
        String image,
        @Schema(description = "Image format hint such as png or jpeg")
        String format) {
}
