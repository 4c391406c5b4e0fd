package com.mythosmud.socket.connection;

import com.mythosmud.socket.support.RecordingFrameSink;
import com.mythosmud.socket.support.TestSupport;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionHandleTest {

    @Test
    void testWrite_MapsEmitResults() {
        RecordingFrameSink sink = new RecordingFrameSink();
        ConnectionHandle handle = new ConnectionHandle("c1", "alice", TransportType.WEBSOCKET, TestSupport.START, sink);

        assertEquals(WriteOutcome.WRITTEN, handle.write("a"));

        sink.failWith(Sinks.EmitResult.FAIL_OVERFLOW);
        assertEquals(WriteOutcome.BACKPRESSURE_DROPPED, handle.write("b"));
        assertTrue(handle.isOpen());

        sink.failWith(Sinks.EmitResult.FAIL_CANCELLED);
        assertEquals(WriteOutcome.CLOSED, handle.write("c"));
        assertFalse(handle.isOpen());
    }

    @Test
    void testInvalidate_IsIdempotentAndBlocksWrites() {
        RecordingFrameSink sink = new RecordingFrameSink();
        ConnectionHandle handle = new ConnectionHandle("c1", "alice", TransportType.STREAM, TestSupport.START, sink);

        handle.invalidate();
        handle.invalidate();

        assertTrue(sink.isCompleted());
        assertEquals(WriteOutcome.CLOSED, handle.write("late"));
        assertTrue(sink.written().isEmpty());
    }

    @Test
    void testOnInvalidate_RunsCloseActionOnce() {
        ConnectionHandle handle = new ConnectionHandle("c1", "alice", TransportType.WEBSOCKET, TestSupport.START,
            new RecordingFrameSink());
        AtomicInteger closes = new AtomicInteger();
        handle.onInvalidate(closes::incrementAndGet);

        handle.invalidate();
        handle.invalidate();

        assertEquals(1, closes.get());
    }

    @Test
    void testOnInvalidate_AlreadyInvalidatedRunsImmediately() {
        ConnectionHandle handle = new ConnectionHandle("c1", "alice", TransportType.STREAM, TestSupport.START,
            new RecordingFrameSink());
        handle.invalidate();
        AtomicInteger closes = new AtomicInteger();

        handle.onInvalidate(closes::incrementAndGet);

        assertEquals(1, closes.get());
    }

    @Test
    void testReactorFrameSink_BuffersUntilSubscribed() {
        ConnectionHandle handle = new ConnectionHandle("c1", "alice", TransportType.WEBSOCKET, TestSupport.START,
            new ReactorFrameSink(16));

        handle.write("one");
        handle.write("two");
        handle.invalidate();

        StepVerifier.create(handle.outbound())
            .expectNext("one", "two")
            .verifyComplete();
    }
}
