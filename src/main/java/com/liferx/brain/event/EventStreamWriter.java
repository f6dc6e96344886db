package com.liferx.brain.event;

import com.liferx.brain.core.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binds an encoder to a sink for one run.
 *
 * A failed write means the client is gone: the run's cancellation token is
 * tripped and later events are dropped. The sink is completed at most once,
 * and a frame id at or below the last one written is never written again.
 */
@Slf4j
public class EventStreamWriter {

    private final EventProtocolEncoder encoder;
    private final EventSink sink;
    private final CancellationToken cancellation;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong lastSentId = new AtomicLong(0);

    public EventStreamWriter(EventProtocolEncoder encoder, EventSink sink, CancellationToken cancellation) {
        this.encoder = encoder;
        this.sink = sink;
        this.cancellation = cancellation;
    }

    /**
     * @return true if the event was written to the sink
     */
    public boolean emit(StreamEvent event) {
        if (closed.get() || cancellation.isCancelled()) {
            return false;
        }
        Optional<EncodedFrame> frame = encoder.encode(event);
        if (frame.isEmpty()) {
            log.debug("Dropping {} after final", event.getClass().getSimpleName());
            return false;
        }
        long id = frame.get().id();
        if (lastSentId.getAndAccumulate(id, Math::max) >= id) {
            log.warn("Frame {} already written, skipping", id);
            return false;
        }
        try {
            sink.send(frame.get());
            return true;
        } catch (IOException | IllegalStateException e) {
            log.info("Client stream write failed, cancelling run: {}", e.getMessage());
            cancellation.cancel();
            return false;
        }
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                sink.complete();
            } catch (RuntimeException e) {
                log.debug("Stream completion failed: {}", e.getMessage());
            }
        }
    }

    public boolean isFinalSent() {
        return encoder.isFinalEncoded();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
