package com.ryuqq.roompeek.core.spi;

import java.util.List;

/**
 * Directory lookup response.
 *
 * @param roomId the resolved room ID, empty when the alias is unknown
 * @param serverNames servers known to participate in the room, in preference order
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record DirectoryLookupResponse(String roomId, List<String> serverNames) {

    public DirectoryLookupResponse {
        if (roomId == null) {
            roomId = "";
        }
        serverNames = serverNames == null ? List.of() : List.copyOf(serverNames);
    }

    /**
     * Response for an alias the remote server does not know.
     *
     * @return a response with an empty room ID and no servers
     */
    public static DirectoryLookupResponse notFound() {
        return new DirectoryLookupResponse("", List.of());
    }
}
