package com.mythosmud.socket.support;

import com.mythosmud.core.util.JsonUtils;
import com.mythosmud.socket.connection.FrameSink;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Frame sink that keeps every accepted frame, or fails with a preset result.
 */
public class RecordingFrameSink implements FrameSink {
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile Sinks.EmitResult failure;
    private volatile boolean completed;

    public void failWith(Sinks.EmitResult result) {
        this.failure = result;
    }

    @Override
    public Sinks.EmitResult tryEmit(String frame) {
        Sinks.EmitResult result = failure;
        if (result != null) {
            return result;
        }
        frames.add(frame);
        return Sinks.EmitResult.OK;
    }

    @Override
    public void complete() {
        completed = true;
    }

    @Override
    public Flux<String> frames() {
        return Flux.fromIterable(frames);
    }

    public List<String> written() {
        return List.copyOf(frames);
    }

    public List<Map<String, Object>> writtenJson() {
        return frames.stream().map(JsonUtils::readMap).collect(Collectors.toList());
    }

    public boolean isCompleted() {
        return completed;
    }
}
