package com.mocha.supporters.sync.assets;

import com.mocha.supporters.sync.model.ImageDimensions;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Identifies image payloads from their leading bytes. Transport headers are never consulted.
 */
public final class ImageFormatSniffer {
    private static final byte[] PNG_SIGNATURE = {
        (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'
    };
    private static final byte[] IHDR = "IHDR".getBytes(StandardCharsets.US_ASCII);
    // signature (8) + chunk length (4) + chunk type (4) + width (4) + height (4)
    private static final int PNG_HEADER_LENGTH = 24;

    private ImageFormatSniffer() {
    }

    public static ImageFormat detect(byte[] bytes) {
        if (bytes == null || bytes.length < 4) {
            return ImageFormat.UNKNOWN;
        }
        if (startsWith(bytes, PNG_SIGNATURE)) {
            return hasPngHeader(bytes) ? ImageFormat.PNG : ImageFormat.UNKNOWN;
        }
        int b0 = bytes[0] & 0xFF;
        int b1 = bytes[1] & 0xFF;
        int b2 = bytes[2] & 0xFF;
        if (b0 == 0xFF && b1 == 0xD8 && b2 == 0xFF) {
            return ImageFormat.JPEG;
        }
        if (b0 == 'G' && b1 == 'I' && b2 == 'F' && bytes[3] == '8') {
            return ImageFormat.GIF;
        }
        if (bytes.length >= 12
            && b0 == 'R' && b1 == 'I' && b2 == 'F' && bytes[3] == 'F'
            && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
            return ImageFormat.WEBP;
        }
        if (b0 == 'B' && b1 == 'M') {
            return ImageFormat.BMP;
        }
        if (b0 == 0 && b1 == 0 && b2 == 1 && bytes[3] == 0) {
            return ImageFormat.ICO;
        }
        return ImageFormat.UNKNOWN;
    }

    public static boolean isPng(byte[] bytes) {
        return detect(bytes) == ImageFormat.PNG;
    }

    /**
     * Width and height from the PNG IHDR chunk, or empty when the payload is not a PNG.
     */
    public static Optional<ImageDimensions> pngDimensions(byte[] bytes) {
        if (!isPng(bytes)) {
            return Optional.empty();
        }
        return Optional.of(new ImageDimensions(readInt(bytes, 16), readInt(bytes, 20)));
    }

    private static boolean hasPngHeader(byte[] bytes) {
        if (bytes.length < PNG_HEADER_LENGTH) {
            return false;
        }
        for (int i = 0; i < IHDR.length; i++) {
            if (bytes[12 + i] != IHDR[i]) {
                return false;
            }
        }
        return readInt(bytes, 16) > 0 && readInt(bytes, 20) > 0;
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static int readInt(byte[] bytes, int offset) {
        return ((bytes[offset] & 0xFF) << 24)
            | ((bytes[offset + 1] & 0xFF) << 16)
            | ((bytes[offset + 2] & 0xFF) << 8)
            | (bytes[offset + 3] & 0xFF);
    }
}
