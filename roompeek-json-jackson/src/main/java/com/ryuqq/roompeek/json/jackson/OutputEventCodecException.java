package com.ryuqq.roompeek.json.jackson;

/**
 * Thrown when an output event cannot be encoded or decoded.
 */
public class OutputEventCodecException extends RuntimeException {

    public OutputEventCodecException(String message) {
        super(message);
    }

    public OutputEventCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
