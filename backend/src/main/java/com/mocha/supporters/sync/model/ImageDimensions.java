package com.mocha.supporters.sync.model;

public record ImageDimensions(int width, int height) {
}
