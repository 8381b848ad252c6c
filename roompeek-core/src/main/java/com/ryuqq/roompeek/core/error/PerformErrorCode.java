package com.ryuqq.roompeek.core.error;

/**
 * Peek 처리 실패 코드.
 *
 * <p>세 가지 코드 모두 재시도 대상이 아닙니다. 재시도 여부는 호출자가 결정합니다.</p>
 *
 * <ul>
 *   <li>{@link #BAD_REQUEST}: 잘못된 식별자, 다른 서버 소속 사용자, 잘못된 참조 형식</li>
 *   <li>{@link #NOT_ALLOWED}: 룸 가시성 정책이 peek을 거부함</li>
 *   <li>{@link #INTERNAL}: 협력 컴포넌트 실패, 디코딩 실패, 별칭 미발견, 취소</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public enum PerformErrorCode {

    BAD_REQUEST(400, "M_UNKNOWN"),
    NOT_ALLOWED(403, "M_FORBIDDEN"),
    INTERNAL(500, "M_UNKNOWN");

    private final int httpStatus;
    private final String errcode;

    PerformErrorCode(int httpStatus, String errcode) {
        this.httpStatus = httpStatus;
        this.errcode = errcode;
    }

    /**
     * 클라이언트 응답에 사용할 HTTP 상태 코드.
     *
     * @return HTTP 상태 코드
     */
    public int httpStatus() {
        return httpStatus;
    }

    /**
     * 클라이언트 응답에 사용할 오류 코드 문자열.
     *
     * @return 오류 코드 (예: M_FORBIDDEN)
     */
    public String errcode() {
        return errcode;
    }
}
