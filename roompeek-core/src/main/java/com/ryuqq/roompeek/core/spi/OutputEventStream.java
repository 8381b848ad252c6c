package com.ryuqq.roompeek.core.spi;

import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.event.OutputEvent;

import java.util.List;

/**
 * Durable, append-only output event stream SPI.
 *
 * <p>Accepted actions are recorded here for downstream consumers. The stream never
 * deduplicates: appending the same event twice yields two records.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent appends must not interleave within one call</li>
 *   <li>Ordering: events of one call are stored in the given order</li>
 *   <li>At-least-once: a successful return means the events are durable</li>
 *   <li>Cancellation: a done context must be rejected before anything is written</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public interface OutputEventStream {

    /**
     * Appends events to the stream.
     *
     * @param context the caller's cancellation context
     * @param roomId partition key; all events of a room are kept in order
     * @param events events to append, in order
     * @throws OutputEventStreamException if the append fails
     * @throws IllegalArgumentException if roomId is blank or events is null/empty
     */
    void append(PeekContext context, String roomId, List<OutputEvent> events);
}
