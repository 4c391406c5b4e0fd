package com.mythosmud.socket.payload;

import com.google.common.io.BaseEncoding;
import com.mythosmud.core.util.JsonUtils;
import com.mythosmud.socket.config.SocketConfig;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Shapes outbound payloads just before they hit a transport.
 * <p>
 * <b>Policy:</b>
 * <ul>
 *   <li>below {@code compressionThreshold}: sent as is</li>
 *   <li>from the threshold up to {@code maxPayloadSize}: gzip, kept only if at least 10% smaller</li>
 *   <li>above {@code maxPayloadSize}: always gzip; rejected if the result exceeds {@code maxCompressedSize}</li>
 * </ul>
 * Forced compression skips the threshold and the 10% rule, not the ceiling.
 * </p>
 * <p>
 * Stateless and safe to share between threads.
 * </p>
 */
public class PayloadOptimizer {
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();
    private static final double MIN_SAVING = 0.10;

    private final int compressionThreshold;
    private final int maxPayloadSize;
    private final int maxCompressedSize;

    public PayloadOptimizer(int compressionThreshold, int maxPayloadSize, int maxCompressedSize) {
        this.compressionThreshold = compressionThreshold;
        this.maxPayloadSize = maxPayloadSize;
        this.maxCompressedSize = maxCompressedSize;
    }

    public PayloadOptimizer(SocketConfig config) {
        this(config.getCompressionThreshold(), config.getMaxPayloadSize(), config.getMaxCompressedSize());
    }

    /**
     * UTF-8 byte length of the payload's JSON form.
     */
    public int sizeOf(Object payload) {
        return JsonUtils.writeValueAsBytes(payload).length;
    }

    /**
     * Checks that {@link #optimize(Object)} would accept the payload. Only payloads above
     * {@code maxPayloadSize} are compressed to find out.
     *
     * @throws PayloadTooLargeException when the payload cannot be delivered at any size
     */
    public void requireDeliverable(Object payload) {
        byte[] json = JsonUtils.writeValueAsBytes(payload);
        if (json.length <= maxPayloadSize) {
            return;
        }
        byte[] gzipped = gzip(json);
        if (gzipped.length > maxCompressedSize) {
            throw new PayloadTooLargeException(json.length, gzipped.length, maxCompressedSize);
        }
    }

    public OptimizedPayload optimize(Object payload) {
        return optimize(payload, false);
    }

    /**
     * @throws PayloadTooLargeException when a compressed result is required and still too big
     */
    public OptimizedPayload optimize(Object payload, boolean forceCompression) {
        byte[] json = JsonUtils.writeValueAsBytes(payload);
        int size = json.length;

        if (!forceCompression && size < compressionThreshold) {
            return OptimizedPayload.passThrough(payload, size);
        }

        byte[] gzipped = gzip(json);
        boolean mustCompress = forceCompression || size > maxPayloadSize;

        if (mustCompress) {
            if (gzipped.length > maxCompressedSize) {
                throw new PayloadTooLargeException(size, gzipped.length, maxCompressedSize);
            }
            return OptimizedPayload.compressed(toCompressed(gzipped, size));
        }

        if (gzipped.length <= size * (1 - MIN_SAVING)) {
            return OptimizedPayload.compressed(toCompressed(gzipped, size));
        }
        return OptimizedPayload.passThrough(payload, size);
    }

    /**
     * Restores the JSON text of a compressed payload.
     */
    public String decompress(CompressedPayload compressed) {
        byte[] gzipped = HEX.decode(compressed.getData());
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(gzipped))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Corrupt compressed payload", e);
        }
    }

    /**
     * Builds a delta between two state snapshots.
     * <p>
     * No prior snapshot yields {@code current} itself. Otherwise the result is
     * {@code {incremental:true, changes:{...}}} with changed or added keys, plus
     * {@code removed:[...]} when keys disappeared.
     * </p>
     */
    public Map<String, Object> incremental(Map<String, Object> current, Map<String, Object> previous) {
        if (previous == null) {
            return current;
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        current.forEach((key, value) -> {
            if (!previous.containsKey(key) || !Objects.equals(previous.get(key), value)) {
                changes.put(key, value);
            }
        });

        List<String> removed = new ArrayList<>();
        for (String key : previous.keySet()) {
            if (!current.containsKey(key)) {
                removed.add(key);
            }
        }

        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put("incremental", true);
        delta.put("changes", changes);
        if (!removed.isEmpty()) {
            delta.put("removed", removed);
        }
        return delta;
    }

    private static CompressedPayload toCompressed(byte[] gzipped, int originalSize) {
        double ratio = originalSize == 0 ? 1.0 : (double) gzipped.length / originalSize;
        return new CompressedPayload(true, HEX.encode(gzipped), originalSize, gzipped.length, ratio);
    }

    private static byte[] gzip(byte[] input) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(input.length / 4, 64));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(input);
        } catch (IOException e) {
            throw new UncheckedIOException("gzip failed", e);
        }
        return out.toByteArray();
    }
}
