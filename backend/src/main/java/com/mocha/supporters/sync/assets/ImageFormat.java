package com.mocha.supporters.sync.assets;

public enum ImageFormat {
    PNG,
    JPEG,
    GIF,
    WEBP,
    BMP,
    ICO,
    UNKNOWN
}
