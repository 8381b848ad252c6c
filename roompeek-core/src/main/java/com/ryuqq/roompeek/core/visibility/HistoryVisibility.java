package com.ryuqq.roompeek.core.visibility;

import java.util.Optional;

/**
 * 룸 히스토리 가시성 값.
 *
 * <p>{@link #WORLD_READABLE}만 비회원 peek을 허용합니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public enum HistoryVisibility {

    WORLD_READABLE("world_readable"),
    SHARED("shared"),
    INVITED("invited"),
    JOINED("joined");

    /** 히스토리 가시성 상태 이벤트 타입. */
    public static final String EVENT_TYPE = "m.room.history_visibility";

    /** 히스토리 가시성 상태 이벤트의 state key. */
    public static final String STATE_KEY = "";

    /** 콘텐츠에서 가시성 값을 담는 키. */
    public static final String CONTENT_KEY = "history_visibility";

    private final String value;

    HistoryVisibility(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 문자열 값으로 조회 (대소문자 구분, 정확히 일치해야 함).
     *
     * @param value 콘텐츠 값
     * @return 일치하는 가시성 (없으면 empty)
     */
    public static Optional<HistoryVisibility> fromValue(String value) {
        for (HistoryVisibility visibility : values()) {
            if (visibility.value.equals(value)) {
                return Optional.of(visibility);
            }
        }
        return Optional.empty();
    }
}
