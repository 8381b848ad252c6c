package com.ryuqq.roompeek.core.error;

/**
 * 구조화된 Peek 처리 오류.
 *
 * <p>PeekOrchestrator 밖으로 나가는 모든 오류는 이 타입입니다.
 * 하위 계층의 오류는 경계를 넘기 전에 반드시 래핑됩니다.</p>
 *
 * @param code 오류 코드
 * @param msg 사람이 읽을 수 있는 메시지
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record PerformError(
    PerformErrorCode code,
    String msg
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 null이거나 msg가 null/빈 문자열인 경우
     */
    public PerformError {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (msg == null || msg.isBlank()) {
            throw new IllegalArgumentException("msg cannot be null or blank");
        }
    }

    public static PerformError badRequest(String msg) {
        return new PerformError(PerformErrorCode.BAD_REQUEST, msg);
    }

    public static PerformError notAllowed(String msg) {
        return new PerformError(PerformErrorCode.NOT_ALLOWED, msg);
    }

    public static PerformError internal(String msg) {
        return new PerformError(PerformErrorCode.INTERNAL, msg);
    }

    @Override
    public String toString() {
        return code + ": " + msg;
    }
}
