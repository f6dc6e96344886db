package com.liferx.brain.event;

/**
 * A serialized event ready to write: SSE id plus JSON body.
 */
public record EncodedFrame(long id, String json, boolean terminal) {
}
