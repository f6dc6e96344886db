package com.liferx.brain.exception;

/**
 * Unrecoverable failure inside the agent, most often a model backend fault.
 * Mapped to HTTP 500 outside a stream, to an error final event inside one.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
