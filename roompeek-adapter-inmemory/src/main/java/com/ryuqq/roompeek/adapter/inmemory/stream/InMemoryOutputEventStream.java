package com.ryuqq.roompeek.adapter.inmemory.stream;

import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.event.OutputEvent;
import com.ryuqq.roompeek.core.spi.OutputEventStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory implementation of {@link OutputEventStream} SPI for testing and reference purposes.
 *
 * <p>Appends are serialized on the instance monitor so the events of one call stay
 * contiguous. Nothing is deduplicated.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class InMemoryOutputEventStream implements OutputEventStream {

    /**
     * One stored record: the partition key and the event.
     *
     * @param roomId partition key
     * @param event the event
     */
    public record Entry(String roomId, OutputEvent event) {
    }

    private final List<Entry> entries = new ArrayList<>();

    /**
     * {@inheritDoc}
     */
    @Override
    public void append(PeekContext context, String roomId, List<OutputEvent> events) {
        Objects.requireNonNull(context, "context");
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId cannot be null or blank");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        List<Entry> batch = new ArrayList<>(events.size());
        for (OutputEvent event : events) {
            batch.add(new Entry(roomId, Objects.requireNonNull(event, "event")));
        }
        context.throwIfDone();
        synchronized (entries) {
            entries.addAll(batch);
        }
    }

    /**
     * Returns every stored record in append order.
     *
     * @return snapshot of stored records
     */
    public List<Entry> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    /**
     * Returns the stored events in append order.
     *
     * @return snapshot of stored events
     */
    public List<OutputEvent> events() {
        return entries().stream().map(Entry::event).toList();
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    /**
     * Clears all records. Used for test cleanup.
     */
    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }
}
