package com.mythosmud.socket.payload;

import lombok.Getter;

/**
 * Thrown when a payload is still above the compressed size ceiling after compression.
 */
@Getter
public class PayloadTooLargeException extends RuntimeException {
    private final int originalSize;
    private final int compressedSize;
    private final int limit;

    public PayloadTooLargeException(int originalSize, int compressedSize, int limit) {
        super(String.format("Payload of %d bytes compresses to %d bytes, above the %d byte limit",
            originalSize, compressedSize, limit));
        this.originalSize = originalSize;
        this.compressedSize = compressedSize;
        this.limit = limit;
    }
}
