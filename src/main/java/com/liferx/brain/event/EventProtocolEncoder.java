package com.liferx.brain.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.liferx.brain.exception.AgentException;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serializes stream events for one run.
 *
 * Ids start at 1 and increase by one per encoded frame. After a final event
 * has been encoded every further call returns empty, so nothing can trail it.
 * One instance per request.
 */
public class EventProtocolEncoder {

    private final ObjectWriter writer;
    private final AtomicLong nextId = new AtomicLong(1);
    private volatile boolean finalEncoded;

    public EventProtocolEncoder(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerFor(StreamEvent.class);
    }

    public synchronized Optional<EncodedFrame> encode(StreamEvent event) {
        if (finalEncoded) {
            return Optional.empty();
        }
        String json;
        try {
            json = writer.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to encode stream event", e);
        }
        boolean terminal = event instanceof FinalEvent;
        if (terminal) {
            finalEncoded = true;
        }
        return Optional.of(new EncodedFrame(nextId.getAndIncrement(), json, terminal));
    }

    public boolean isFinalEncoded() {
        return finalEncoded;
    }
}
