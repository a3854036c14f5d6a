package com.example.equationreader.util;

import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImagePreprocessorTest {

    @Test
    void shouldFlattenTransparencyOntoWhite() {
        BufferedImage transparent = new BufferedImage(20, 10, BufferedImage.TYPE_INT_ARGB);

        BufferedImage prepared = ImagePreprocessor.prepareForOcr(transparent);

        assertThat(prepared.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(prepared.getRGB(5, 5) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    }

    @Test
    void shouldRejectMissingImage() {
        assertThatThrownBy(() -> ImagePreprocessor.prepareForOcr(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldUpscaleShortCropsAndBinarizeToBlackAndWhite() {
        BufferedImage image = filled(60, 30, Color.WHITE);
        paint(image, Color.BLACK, 10, 10, 20, 10);

        BufferedImage binary = ImagePreprocessor.binarize(image);

        assertThat(binary.getType()).isEqualTo(BufferedImage.TYPE_BYTE_GRAY);
        assertThat(binary.getWidth()).isEqualTo(120);
        assertThat(binary.getHeight()).isEqualTo(60);
        for (int y = 0; y < binary.getHeight(); y++) {
            for (int x = 0; x < binary.getWidth(); x++) {
                assertThat(binary.getRaster().getSample(x, y, 0)).isIn(0, 255);
            }
        }
        assertThat(binary.getRaster().getSample(40, 30, 0)).isEqualTo(0);
        assertThat(binary.getRaster().getSample(100, 10, 0)).isEqualTo(255);
    }

    @Test
    void shouldKeepFaintStrokesAsInk() {
        BufferedImage image = filled(100, 60, Color.WHITE);
        paint(image, new Color(200, 200, 200), 10, 28, 80, 2);

        BufferedImage binary = ImagePreprocessor.binarize(image);

        assertThat(binary.getWidth()).isEqualTo(100);
        assertThat(binary.getRaster().getSample(50, 29, 0)).isEqualTo(0);
        assertThat(binary.getRaster().getSample(50, 5, 0)).isEqualTo(255);
    }

    @Test
    void shouldPlaceOtsuThresholdBetweenInkAndPaper() {
        BufferedImage image = filled(40, 40, Color.WHITE);
        paint(image, new Color(60, 60, 60), 0, 0, 40, 10);
        BufferedImage gray = new BufferedImage(40, 40, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D graphics = gray.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }

        int ink = gray.getRaster().getSample(5, 5, 0);
        int paper = gray.getRaster().getSample(5, 30, 0);

        assertThat(ImagePreprocessor.otsuThreshold(gray)).isGreaterThanOrEqualTo(ink).isLessThan(paper);
    }

    private static BufferedImage filled(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        paint(image, color, 0, 0, width, height);
        return image;
    }

    private static void paint(BufferedImage image, Color color, int x, int y, int width, int height) {
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(color);
            graphics.fillRect(x, y, width, height);
        } finally {
            graphics.dispose();
        }
    }
}
