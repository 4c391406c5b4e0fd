package com.mythosmud.socket.connection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * {@link FrameSink} over a Reactor multicast sink with a bounded backpressure buffer.
 * <p>
 * Frames emitted before the transport subscribes are buffered up to the same bound.
 * </p>
 */
public class ReactorFrameSink implements FrameSink {
    private final Sinks.Many<String> sink;

    public ReactorFrameSink(int bufferSize) {
        this.sink = Sinks.many().multicast().onBackpressureBuffer(bufferSize, false);
    }

    @Override
    public Sinks.EmitResult tryEmit(String frame) {
        return sink.tryEmitNext(frame);
    }

    @Override
    public void complete() {
        sink.tryEmitComplete();
    }

    @Override
    public Flux<String> frames() {
        return sink.asFlux();
    }
}
