package com.ryuqq.roompeek.core.spi;

/**
 * Thrown by {@link DirectoryLookup} implementations when the remote query fails.
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class DirectoryLookupException extends RuntimeException {

    public DirectoryLookupException(String message) {
        super(message);
    }

    public DirectoryLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
