package com.ryuqq.roompeek.core.spi;

/**
 * Room state event as read from storage.
 *
 * <p>The content is kept as the raw JSON text; decoding is the job of a
 * {@link StateContentDecoder}.</p>
 *
 * @param roomId the room the event belongs to
 * @param eventType the event type
 * @param stateKey the state key
 * @param content raw JSON content
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record StateEvent(
    String roomId,
    String eventType,
    String stateKey,
    String content
) {

    public StateEvent {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId cannot be null or blank");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (stateKey == null) {
            throw new IllegalArgumentException("stateKey cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }
}
