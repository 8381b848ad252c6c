package com.ryuqq.roompeek.core.spi;

/**
 * Thrown by {@link OutputEventStream} implementations when an append fails.
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class OutputEventStreamException extends RuntimeException {

    public OutputEventStreamException(String message) {
        super(message);
    }

    public OutputEventStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
