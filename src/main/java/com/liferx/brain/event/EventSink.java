package com.liferx.brain.event;

import java.io.IOException;

/**
 * Transport the encoded frames are written to.
 */
public interface EventSink {

    void send(EncodedFrame frame) throws IOException;

    /** Ends the stream. Called exactly once per run. */
    void complete();
}
