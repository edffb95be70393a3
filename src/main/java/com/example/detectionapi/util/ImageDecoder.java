package com.example.detectionapi.util;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

/**
 * Decodes uploaded image bytes with {@link ImageIO}. Only JPEG, PNG, BMP and TIFF payloads are
 * accepted, whatever other readers happen to be registered.
 */
public final class ImageDecoder {

    public static final Set<String> SUPPORTED_FORMATS = Set.of("jpeg", "png", "bmp", "tiff");

    private ImageDecoder() {
    }

    /**
     * @throws IllegalArgumentException when the bytes are empty, in an unsupported format or corrupt
     */
    public static BufferedImage decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Image payload is empty");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (input == null) {
                throw new IllegalArgumentException("Unable to open image payload");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new IllegalArgumentException("Unrecognised image format");
            }
            ImageReader reader = readers.next();
            try {
                String format = normalizeFormat(reader.getFormatName());
                if (!SUPPORTED_FORMATS.contains(format)) {
                    throw new IllegalArgumentException("Unsupported image format: " + format);
                }
                reader.setInput(input, true, true);
                BufferedImage image = reader.read(0);
                if (image == null) {
                    throw new IllegalArgumentException("Unable to decode provided image");
                }
                return image;
            } finally {
                reader.dispose();
            }
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to decode provided image: " + ex.getMessage(), ex);
        }
    }

    private static String normalizeFormat(String formatName) {
        String format = formatName == null ? "" : formatName.toLowerCase(Locale.ROOT);
        switch (format) {
            case "jpg":
                return "jpeg";
            case "tif":
                return "tiff";
            default:
                return format;
        }
    }
}
