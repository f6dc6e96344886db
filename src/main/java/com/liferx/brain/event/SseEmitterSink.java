package com.liferx.brain.event;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

@RequiredArgsConstructor
public class SseEmitterSink implements EventSink {

    private final SseEmitter emitter;

    @Override
    public void send(EncodedFrame frame) throws IOException {
        emitter.send(SseEmitter.event()
                .id(Long.toString(frame.id()))
                .data(frame.json(), MediaType.APPLICATION_JSON));
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
