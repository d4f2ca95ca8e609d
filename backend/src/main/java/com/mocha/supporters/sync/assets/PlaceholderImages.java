package com.mocha.supporters.sync.assets;

import com.mocha.supporters.sync.model.Bucket;
import com.mocha.supporters.sync.model.ImageDimensions;

import java.util.Base64;

/**
 * Blank {@code #f9f9f9} PNGs written in place of avatars the CDN did not serve as PNG.
 */
public final class PlaceholderImages {
    private static final byte[] BLANK_64 = Base64.getDecoder().decode(
        "iVBORw0KGgoAAAANSUhEUgAAAEAAAABACAQAAAAAYLlVAAAAPElEQVR42u3OMQEAAAgDINc/sZfG2AMJyN5URUBAQEBAQEBAQEBA"
            + "QEBAQEBAQEBAQEBAQEBAQEBAQKAdeHK9fkGpx7l4AAAAAElFTkSuQmCC"
    );
    private static final byte[] BLANK_32 = Base64.getDecoder().decode(
        "iVBORw0KGgoAAAANSUhEUgAAACAAAAAgCAQAAADZc7J/AAAAIUlEQVR42mP8+Z+BIsA4asCoAaMGjBowasCoAaMGDDcDAC5IPyHF"
            + "Dzg6AAAAAElFTkSuQmCC"
    );

    public static final ImageDimensions SPONSOR_DIMENSIONS = new ImageDimensions(64, 64);
    public static final ImageDimensions BACKER_DIMENSIONS = new ImageDimensions(32, 32);

    private PlaceholderImages() {
    }

    public static byte[] blank64() {
        return BLANK_64.clone();
    }

    public static byte[] blank32() {
        return BLANK_32.clone();
    }

    public static byte[] forBucket(Bucket bucket) {
        return bucket == Bucket.SPONSOR ? blank64() : blank32();
    }

    public static ImageDimensions dimensionsFor(Bucket bucket) {
        return bucket == Bucket.SPONSOR ? SPONSOR_DIMENSIONS : BACKER_DIMENSIONS;
    }
}
