package com.ryuqq.roompeek.core.spi;

/**
 * Thrown by {@link StateContentDecoder} implementations when content cannot be decoded.
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class StateContentDecodeException extends RuntimeException {

    public StateContentDecodeException(String message) {
        super(message);
    }

    public StateContentDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
