package com.example.detectionapi.util;

import java.awt.image.BufferedImage;
import java.util.Random;

/**
 * Builds the fixed image used to warm the model up: seeded RGB noise, so every start sees the
 * same pixels.
 */
public final class WarmupImageFactory {

    private WarmupImageFactory() {
    }

    public static BufferedImage create(int width, int height, long seed) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Warmup image dimensions must be positive");
        }
        Random random = new Random(seed);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, random.nextInt(0x1000000));
            }
        }
        return image;
    }
}
