package com.volunteermedia.upload;

/**
 * Image bytes ready for storage.
 */
public record ProcessedImage(byte[] data, String contentType, int width, int height) {
}
