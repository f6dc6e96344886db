package com.liferx.brain.api;

import com.liferx.brain.config.AgentProperties;
import com.liferx.brain.exception.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the internal endpoints with the X-Internal-Secret header.
 * An unconfigured secret rejects every call.
 */
@Component
@RequiredArgsConstructor
public class InternalSecretVerifier {

    public static final String HEADER = "X-Internal-Secret";

    private final AgentProperties properties;

    public void verify(String provided) {
        String expected = properties.getInternalSecret();
        if (expected == null || expected.isBlank()) {
            throw new UnauthorizedException("internal secret is not configured");
        }
        if (provided == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("missing or wrong " + HEADER + " header");
        }
    }
}
