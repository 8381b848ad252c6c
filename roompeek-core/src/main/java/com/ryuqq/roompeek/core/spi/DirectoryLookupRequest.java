package com.ryuqq.roompeek.core.spi;

/**
 * Directory lookup request.
 *
 * @param roomAlias the alias to look up (e.g. {@code #x:remoteB})
 * @param serverName the server to ask (the alias domain)
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record DirectoryLookupRequest(String roomAlias, String serverName) {

    public DirectoryLookupRequest {
        if (roomAlias == null || roomAlias.isBlank()) {
            throw new IllegalArgumentException("roomAlias cannot be null or blank");
        }
        if (serverName == null || serverName.isBlank()) {
            throw new IllegalArgumentException("serverName cannot be null or blank");
        }
    }
}
