package com.example.equationreader.controller;

import com.example.equationreader.exception.InvalidImageDataException;
import com.example.equationreader.exception.InvalidRequestException;
import com.example.equationreader.model.CanonicalResult;
import com.example.equationreader.model.CanonicalizeRequest;
import com.example.equationreader.model.ErrorResponse;
import com.example.equationreader.model.HealthResponse;
import com.example.equationreader.model.RecognitionRequest;
import com.example.equationreader.model.RecognitionResponse;
import com.example.equationreader.service.EquationRecognitionService;
import com.example.equationreader.service.ocr.RecognitionModelHolder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;

@RestController
@Tag(name = "Equation Reader", description = "Equation image recognition and LaTeX repair endpoints")
public class EquationController {

    private static final String SERVICE_NAME = "equation-reader";

    private final EquationRecognitionService service;
    private final RecognitionModelHolder modelHolder;

    public EquationController(EquationRecognitionService service, RecognitionModelHolder modelHolder) {
        this.service = service;
        this.modelHolder = modelHolder;
    }

    @PostMapping(value = "/recognize", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Recognize a base64 encoded equation image",
            description = "Runs OCR on the image and returns the repaired, validated expression",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Recognition result",
                            content = @Content(schema = @Schema(implementation = RecognitionResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid payload or image",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "503", description = "OCR model not ready"),
                    @ApiResponse(responseCode = "504", description = "Recognition timed out")
            })
    public ResponseEntity<RecognitionResponse> recognize(@RequestBody RecognitionRequest request) {
        if (request == null || !StringUtils.hasText(request.image())) {
            throw new InvalidRequestException("Missing 'image' field in request body");
        }
        return ResponseEntity.ok(service.recognize(readImageFromBase64(request.image())));
    }

    @PostMapping(value = "/recognize/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Recognize an uploaded equation image")
    public ResponseEntity<RecognitionResponse> recognizeFile(@RequestPart("image") MultipartFile image) {
        if (image == null || image.isEmpty()) {
            throw new InvalidRequestException("Uploaded image must not be empty");
        }
        try (InputStream inputStream = image.getInputStream()) {
            return ResponseEntity.ok(service.recognize(decode(inputStream)));
        } catch (IOException ex) {
            throw new InvalidImageDataException("Failed to read uploaded image", ex);
        }
    }

    @PostMapping(value = "/canonicalize", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Repair and validate LaTeX markup",
            description = "Runs the cleaning and validation pipeline on markup that was recognized elsewhere")
    public ResponseEntity<RecognitionResponse> canonicalize(@Valid @RequestBody CanonicalizeRequest request) {
        CanonicalResult result = service.canonicalize(request.latex());
        return ResponseEntity.ok(RecognitionResponse.of(result, null));
    }

    @GetMapping("/health")
    @Operation(summary = "Report service and OCR model readiness")
    public ResponseEntity<HealthResponse> health() {
        boolean ready = modelHolder.isReady();
        return ResponseEntity.ok(new HealthResponse(
                ready ? "healthy" : "degraded",
                SERVICE_NAME,
                ready,
                modelHolder.getEngineName(),
                modelHolder.getLastLoadError(),
                modelHolder.getMaxConcurrency()));
    }

    private BufferedImage readImageFromBase64(String encodedImage) {
        String payload = encodedImage.strip();
        int comma = payload.indexOf(',');
        if (payload.startsWith("data:") && comma > 0) {
            payload = payload.substring(comma + 1);
        }
        byte[] data;
        try {
            data = Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException ex) {
            throw new InvalidImageDataException("Invalid base64 image data", ex);
        }
        try (ByteArrayInputStream inputStream = new ByteArrayInputStream(data)) {
            return decode(inputStream);
        } catch (IOException ex) {
            throw new InvalidImageDataException("Failed to read base64 image data", ex);
        }
    }

    private static BufferedImage decode(InputStream inputStream) throws IOException {
        BufferedImage image = ImageIO.read(inputStream);
        if (image == null) {
            throw new InvalidImageDataException("Invalid image data: unsupported or corrupted image");
        }
        return image;
    }
}
