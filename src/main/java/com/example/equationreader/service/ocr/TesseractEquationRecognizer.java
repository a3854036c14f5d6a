package com.example.equationreader.service.ocr;

import com.example.equationreader.config.EquationReaderProperties;
import com.example.equationreader.util.ImagePreprocessor;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Local recognizer backed by Tesseract. It reads printed equations as plain infix text
 * ({@code x^2+2x+1=0}) rather than full markup, which the generic parser tiers still accept.
 */
public class TesseractEquationRecognizer implements EquationRecognizer {

    private static final Logger log = LoggerFactory.getLogger(TesseractEquationRecognizer.class);

    private final EquationReaderProperties.Tesseract settings;
    private final ITesseract tesseract;

    public TesseractEquationRecognizer(EquationReaderProperties.Tesseract settings) {
        this(settings, new Tesseract());
    }

    TesseractEquationRecognizer(EquationReaderProperties.Tesseract settings, ITesseract tesseract) {
        this.settings = settings;
        this.tesseract = tesseract;
    }

    @Override
    public String engineName() {
        return "tesseract";
    }

    @Override
    public void load() {
        String resolvedDataPath = resolveDataPath();
        if (resolvedDataPath == null) {
            String message = String.format(Locale.ROOT,
                    "Unable to locate Tesseract language data for '%s'. " +
                            "Provide it via the equation-reader.ocr.tesseract.datapath property or the TESSDATA_PREFIX environment variable.",
                    settings.getLanguage());
            throw new IllegalStateException(message);
        }
        log.info("Configuring Tesseract data path: {}", resolvedDataPath);
        tesseract.setDatapath(resolvedDataPath);
        tesseract.setLanguage(settings.getLanguage());
        tesseract.setOcrEngineMode(1); // LSTM only
        tesseract.setPageSegMode(7); // single text line
        if (settings.getWhitelist() != null && !settings.getWhitelist().isBlank()) {
            tesseract.setVariable("tessedit_char_whitelist", settings.getWhitelist());
        }
    }

    @Override
    public synchronized String recognize(BufferedImage image) {
        try {
            String raw = tesseract.doOCR(ImagePreprocessor.binarize(image));
            return raw == null ? "" : raw.replaceAll("\\s+", " ").trim();
        } catch (TesseractException ex) {
            throw new IllegalStateException("Tesseract failed to read the equation: " + ex.getMessage(), ex);
        }
    }

    String resolveDataPath() {
        List<String> candidates = new ArrayList<>();
        String configured = settings.getDatapath();
        if (configured != null && !configured.isBlank()) {
            candidates.add(configured);
        }
        String envCandidate = System.getenv("TESSDATA_PREFIX");
        if (envCandidate != null && !envCandidate.isBlank()) {
            candidates.add(envCandidate);
        }
        String systemPropertyCandidate = System.getProperty("TESSDATA_PREFIX");
        if (systemPropertyCandidate != null && !systemPropertyCandidate.isBlank()) {
            candidates.add(systemPropertyCandidate);
        }

        candidates.add("/usr/share/tesseract-ocr/5/tessdata");
        candidates.add("/usr/share/tesseract-ocr/4.00/tessdata");
        candidates.add("/opt/homebrew/share/tessdata");
        candidates.add("C:/Program Files/Tesseract-OCR/tessdata");

        for (String candidate : candidates) {
            Path validPath = validateCandidate(candidate);
            if (validPath != null) {
                return validPath.toString();
            }
        }
        return null;
    }

    private Path validateCandidate(String candidate) {
        Path basePath = Paths.get(candidate).normalize();
        if (!Files.isDirectory(basePath)) {
            return null;
        }
        String languageFile = settings.getLanguage() + ".traineddata";
        if (Files.isRegularFile(basePath.resolve(languageFile))) {
            return basePath;
        }
        Path tessdataDirectory = basePath.resolve("tessdata");
        if (Files.isRegularFile(tessdataDirectory.resolve(languageFile))) {
            return tessdataDirectory;
        }
        log.debug("Tesseract data path candidate '{}' does not contain {}", candidate, languageFile);
        return null;
    }
}
