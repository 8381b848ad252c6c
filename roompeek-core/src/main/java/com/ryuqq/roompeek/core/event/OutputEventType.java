package com.ryuqq.roompeek.core.event;

import java.util.Optional;

/**
 * 출력 이벤트 종류.
 *
 * <p>wireName은 직렬화 시 {@code type} 필드와 페이로드 필드 이름으로 사용됩니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public enum OutputEventType {

    /** 새 peek 시작. */
    NEW_PEEK("new_peek");

    private final String wireName;

    OutputEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * wireName으로 종류 조회.
     *
     * @param wireName 직렬화된 이름
     * @return 일치하는 종류 (없으면 empty)
     */
    public static Optional<OutputEventType> fromWireName(String wireName) {
        for (OutputEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
