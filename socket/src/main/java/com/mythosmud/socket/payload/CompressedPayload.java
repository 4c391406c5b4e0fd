package com.mythosmud.socket.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Wire form of a gzip-compressed payload.
 * <p>
 * {@code data} is the gzip stream as lowercase hex. {@code compressionRatio} is
 * {@code compressedSize / originalSize}.
 * </p>
 */
@Value
public class CompressedPayload {

    @JsonProperty("compressed")
    boolean compressed;

    @JsonProperty("data")
    String data;

    @JsonProperty("original_size")
    int originalSize;

    @JsonProperty("compressed_size")
    int compressedSize;

    @JsonProperty("compression_ratio")
    double compressionRatio;

    @JsonCreator
    public CompressedPayload(
        @JsonProperty("compressed") boolean compressed,
        @JsonProperty("data") String data,
        @JsonProperty("original_size") int originalSize,
        @JsonProperty("compressed_size") int compressedSize,
        @JsonProperty("compression_ratio") double compressionRatio
    ) {
        this.compressed = compressed;
        this.data = data;
        this.originalSize = originalSize;
        this.compressedSize = compressedSize;
        this.compressionRatio = compressionRatio;
    }
}
