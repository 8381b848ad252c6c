package com.ryuqq.roompeek.core.event;

/**
 * 새 peek 시작 기록.
 *
 * @param roomId 정규 룸 ID (별칭 불가)
 * @param userId 사용자 ID
 * @param deviceId 디바이스 ID (빈 문자열 허용)
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record OutputNewPeek(
    String roomId,
    String userId,
    String deviceId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException roomId 또는 userId가 null/빈 문자열인 경우
     */
    public OutputNewPeek {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId cannot be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (deviceId == null) {
            deviceId = "";
        }
    }
}
