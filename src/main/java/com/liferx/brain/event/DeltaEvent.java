package com.liferx.brain.event;

public record DeltaEvent(String content) implements StreamEvent {
}
