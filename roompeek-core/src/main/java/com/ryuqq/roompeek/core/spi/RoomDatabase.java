package com.ryuqq.roompeek.core.spi;

import com.ryuqq.roompeek.core.context.PeekContext;

import java.util.Optional;

/**
 * Read-only room storage SPI.
 *
 * <p>The peek flow reads two things from local storage: the room ID an alias maps to,
 * and the room's current history visibility state event.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Absence is not an error: return {@link Optional#empty()}</li>
 *   <li>Cancellation: must honour {@link PeekContext#throwIfDone()}</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public interface RoomDatabase {

    /**
     * Looks up the room ID for a locally owned alias.
     *
     * @param context the caller's cancellation context
     * @param roomAlias the alias (e.g. {@code #pub:serverA})
     * @return the room ID, or empty if the alias is not known
     * @throws RoomDatabaseException if the storage read fails
     */
    Optional<String> findRoomIdForAlias(PeekContext context, String roomAlias);

    /**
     * Fetches the current state event of a room for the given type and state key.
     *
     * @param context the caller's cancellation context
     * @param roomId the canonical room ID
     * @param eventType the state event type (e.g. {@code m.room.history_visibility})
     * @param stateKey the state key (usually empty)
     * @return the state event, or empty if the room has none
     * @throws RoomDatabaseException if the storage read fails
     */
    Optional<StateEvent> findStateEvent(PeekContext context, String roomId, String eventType, String stateKey);
}
