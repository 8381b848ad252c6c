package com.ryuqq.roompeek.core.event;

/**
 * 출력 스트림에 추가되는 이벤트.
 *
 * <p>type에 해당하는 페이로드 필드 하나만 채워집니다.
 * 현재는 {@link OutputEventType#NEW_PEEK} 하나뿐입니다.</p>
 *
 * <pre>
 * OutputEvent event = OutputEvent.newPeek("!room1:serverA", "@alice:serverA", "DEVICE1");
 * </pre>
 *
 * @param type 이벤트 종류
 * @param newPeek NEW_PEEK 페이로드
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record OutputEvent(
    OutputEventType type,
    OutputNewPeek newPeek
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null이거나 type에 맞는 페이로드가 없는 경우
     */
    public OutputEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == OutputEventType.NEW_PEEK && newPeek == null) {
            throw new IllegalArgumentException("newPeek cannot be null for " + type);
        }
    }

    public static OutputEvent newPeek(String roomId, String userId, String deviceId) {
        return new OutputEvent(OutputEventType.NEW_PEEK, new OutputNewPeek(roomId, userId, deviceId));
    }
}
