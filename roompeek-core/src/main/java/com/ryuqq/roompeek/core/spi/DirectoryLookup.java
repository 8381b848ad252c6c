package com.ryuqq.roompeek.core.spi;

import com.ryuqq.roompeek.core.context.PeekContext;

/**
 * Directory lookup SPI for resolving a room alias on the server that owns it.
 *
 * <p>Implementations perform the cross-server query; the peek flow only calls this
 * for aliases whose domain is not the local server.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: may be called concurrently for different requests</li>
 *   <li>Cancellation: must honour {@link PeekContext#throwIfDone()} and abort in-flight I/O</li>
 *   <li>No internal retries: the caller decides whether to retry</li>
 *   <li>Not-found: return a response with an empty room ID rather than throwing</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public interface DirectoryLookup {

    /**
     * Resolves an alias by asking the given server.
     *
     * @param context the caller's cancellation context
     * @param request the alias and the server to ask
     * @return the resolved room ID (possibly empty) and the servers known to be in the room
     * @throws DirectoryLookupException on any transport or protocol failure
     * @throws com.ryuqq.roompeek.core.context.PeekCancelledException if the context is done
     */
    DirectoryLookupResponse lookup(PeekContext context, DirectoryLookupRequest request);
}
