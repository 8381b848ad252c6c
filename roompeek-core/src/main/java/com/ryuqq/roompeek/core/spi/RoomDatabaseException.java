package com.ryuqq.roompeek.core.spi;

/**
 * Thrown by {@link RoomDatabase} implementations when a storage read fails.
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class RoomDatabaseException extends RuntimeException {

    public RoomDatabaseException(String message) {
        super(message);
    }

    public RoomDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
