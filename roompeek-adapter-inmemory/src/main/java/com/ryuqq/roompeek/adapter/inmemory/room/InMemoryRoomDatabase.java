package com.ryuqq.roompeek.adapter.inmemory.room;

import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.spi.RoomDatabase;
import com.ryuqq.roompeek.core.spi.StateEvent;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link RoomDatabase} SPI for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Aliases:</strong> ConcurrentHashMap&lt;String, String&gt; - alias → room ID</li>
 *   <li><strong>Current State:</strong> ConcurrentHashMap&lt;StateKey, StateEvent&gt; - latest event per (room, type, state key)</li>
 * </ul>
 *
 * <p>Writes ({@link #putAlias}, {@link #putStateEvent}) exist only to seed fixtures;
 * the peek flow itself only reads.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRoomDatabase db = new InMemoryRoomDatabase();
 * db.putAlias("#pub:serverA", "!room1:serverA");
 * db.putStateEvent(new StateEvent("!room1:serverA", "m.room.history_visibility", "",
 *     "{\"history_visibility\":\"world_readable\"}"));
 * </pre>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class InMemoryRoomDatabase implements RoomDatabase {

    private final ConcurrentHashMap<String, String> aliases;
    private final ConcurrentHashMap<StateKey, StateEvent> currentState;

    /**
     * Creates an empty database.
     */
    public InMemoryRoomDatabase() {
        this.aliases = new ConcurrentHashMap<>();
        this.currentState = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<String> findRoomIdForAlias(PeekContext context, String roomAlias) {
        Objects.requireNonNull(context, "context");
        context.throwIfDone();
        if (roomAlias == null) {
            throw new IllegalArgumentException("roomAlias cannot be null");
        }
        return Optional.ofNullable(aliases.get(roomAlias));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<StateEvent> findStateEvent(PeekContext context, String roomId, String eventType, String stateKey) {
        Objects.requireNonNull(context, "context");
        context.throwIfDone();
        return Optional.ofNullable(currentState.get(new StateKey(roomId, eventType, stateKey)));
    }

    /**
     * Maps an alias to a room ID, replacing any previous mapping.
     *
     * @param roomAlias the alias
     * @param roomId the canonical room ID
     */
    public void putAlias(String roomAlias, String roomId) {
        if (roomAlias == null || roomId == null) {
            throw new IllegalArgumentException("roomAlias and roomId cannot be null");
        }
        aliases.put(roomAlias, roomId);
    }

    /**
     * Stores a state event as the room's current state for its (type, state key).
     *
     * @param event the state event
     */
    public void putStateEvent(StateEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        currentState.put(new StateKey(event.roomId(), event.eventType(), event.stateKey()), event);
    }

    /**
     * Clears all aliases and state. Used for test cleanup.
     */
    public void clear() {
        aliases.clear();
        currentState.clear();
    }

    private record StateKey(String roomId, String eventType, String stateKey) {
    }
}
