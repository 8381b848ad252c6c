package com.ryuqq.roompeek.core.visibility;

/**
 * 히스토리 가시성 검사 결과.
 *
 * <p>"레코드 없음", "키 없음", "알 수 없는 값"을 서로 다른 결과로 구분합니다.
 * 모두 peek을 거부하지만 로그와 테스트에서 원인을 구별할 수 있습니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public enum VisibilityCheck {

    /** 가시성 상태 이벤트가 없음 (기본값: 닫힘). */
    RECORD_ABSENT(false),

    /** 이벤트는 있으나 history_visibility 키가 없음. */
    KEY_ABSENT(false),

    /** 알 수 없는 가시성 값. */
    UNRECOGNIZED_VALUE(false),

    /** shared, invited, joined. */
    RESTRICTED(false),

    /** world_readable. */
    WORLD_READABLE(true);

    private final boolean permitsPeek;

    VisibilityCheck(boolean permitsPeek) {
        this.permitsPeek = permitsPeek;
    }

    /**
     * 비회원 peek 허용 여부.
     *
     * @return WORLD_READABLE일 때만 true
     */
    public boolean permitsPeek() {
        return permitsPeek;
    }
}
