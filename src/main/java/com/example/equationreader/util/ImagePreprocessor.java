package com.example.equationreader.util;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;

/**
 * Image helpers used before recognition. {@link #prepareForOcr(BufferedImage)} normalizes any
 * decoded image to opaque RGB; {@link #binarize(BufferedImage)} is the heavier path used ahead
 * of Tesseract.
 */
public final class ImagePreprocessor {

    private static final int MIN_TEXT_HEIGHT = 48;

    private ImagePreprocessor() {
    }

    /**
     * Flattens transparency onto white and converts palette or grayscale images to RGB.
     *
     * @throws IllegalArgumentException when the image is missing or has no pixels
     */
    public static BufferedImage prepareForOcr(BufferedImage input) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        if (input.getWidth() <= 0 || input.getHeight() <= 0) {
            throw new IllegalArgumentException("Input image has no pixels");
        }
        BufferedImage rgb = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
        g.drawImage(input, 0, 0, null);
        g.dispose();
        return rgb;
    }

    /**
     * Black strokes on white for Tesseract. Short crops are upscaled first so that thin
     * fraction bars and exponents survive the threshold.
     */
    public static BufferedImage binarize(BufferedImage input) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        BufferedImage grayscale = toGrayscale(upscale(input));
        return applyThreshold(grayscale, otsuThreshold(grayscale));
    }

    static BufferedImage upscale(BufferedImage input) {
        if (input.getHeight() >= MIN_TEXT_HEIGHT) {
            return input;
        }
        int factor = (MIN_TEXT_HEIGHT + input.getHeight() - 1) / input.getHeight();
        BufferedImage scaled = new BufferedImage(input.getWidth() * factor, input.getHeight() * factor,
                BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, scaled.getWidth(), scaled.getHeight());
        g.drawImage(input, 0, 0, scaled.getWidth(), scaled.getHeight(), null);
        g.dispose();
        return scaled;
    }

    private static BufferedImage toGrayscale(BufferedImage input) {
        BufferedImage grayscale = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = grayscale.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, grayscale.getWidth(), grayscale.getHeight());
        g.drawImage(input, 0, 0, null);
        g.dispose();
        return grayscale;
    }

    /**
     * Otsu's threshold: the gray level that maximizes the between-class variance of the
     * histogram. Levels at or below it are ink.
     */
    static int otsuThreshold(BufferedImage grayscale) {
        int[] histogram = new int[256];
        Raster raster = grayscale.getRaster();
        for (int y = 0; y < grayscale.getHeight(); y++) {
            for (int x = 0; x < grayscale.getWidth(); x++) {
                histogram[raster.getSample(x, y, 0)]++;
            }
        }
        long total = (long) grayscale.getWidth() * grayscale.getHeight();
        double weightedSum = 0;
        for (int level = 0; level < 256; level++) {
            weightedSum += (double) level * histogram[level];
        }

        long background = 0;
        double backgroundSum = 0;
        double bestVariance = -1;
        int threshold = 127;
        for (int level = 0; level < 256; level++) {
            background += histogram[level];
            if (background == 0) {
                continue;
            }
            long foreground = total - background;
            if (foreground == 0) {
                break;
            }
            backgroundSum += (double) level * histogram[level];
            double backgroundMean = backgroundSum / background;
            double foregroundMean = (weightedSum - backgroundSum) / foreground;
            double variance = (double) background * foreground
                    * (backgroundMean - foregroundMean) * (backgroundMean - foregroundMean);
            if (variance > bestVariance) {
                bestVariance = variance;
                threshold = level;
            }
        }
        return threshold;
    }

    private static BufferedImage applyThreshold(BufferedImage grayscale, int threshold) {
        BufferedImage binary = new BufferedImage(grayscale.getWidth(), grayscale.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Raster source = grayscale.getRaster();
        WritableRaster target = binary.getRaster();
        for (int y = 0; y < grayscale.getHeight(); y++) {
            for (int x = 0; x < grayscale.getWidth(); x++) {
                target.setSample(x, y, 0, source.getSample(x, y, 0) > threshold ? 255 : 0);
            }
        }
        return binary;
    }
}
