package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.contract.PeekRequest;
import com.ryuqq.roompeek.core.contract.PeekResult;

/**
 * Peek 요청 처리 진입점.
 *
 * <p>룸 ID 또는 별칭을 받아 정규 룸 ID를 확정하고, 가시성 정책을 적용한 뒤,
 * 수락된 peek을 출력 스트림에 기록합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PeekResult result = orchestrator.performPeek(
 *     PeekContext.withTimeout(2_000), "@alice:serverA", "#pub:serverA", "DEVICE1");
 *
 * if (result.isAccepted()) {
 *     String roomId = result.roomId(); // "!room1:serverA"
 * } else {
 *     PerformError error = result.error();
 *     int status = error.code().httpStatus();
 * }
 * </pre>
 *
 * <p>오류는 예외로 던지지 않고 항상 {@link PeekResult#error()}로 반환합니다.
 * null 사용자 ID나 룸 참조도 BAD_REQUEST 결과가 됩니다. 예외는 context나 request 자체가
 * null인 호출 오류에만 발생합니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public interface PeekOrchestrator {

    /**
     * Peek 수행.
     *
     * @param context 취소 컨텍스트
     * @param userId 요청 사용자 ID (로컬 서버 소속이어야 함)
     * @param roomIdOrAlias 룸 ID ({@code !...}) 또는 별칭 ({@code #...})
     * @param deviceId 디바이스 ID
     * @return 처리 결과 (성공 시 정규 룸 ID, 실패 시 PerformError)
     */
    default PeekResult performPeek(PeekContext context, String userId, String roomIdOrAlias, String deviceId) {
        return performPeek(context, PeekRequest.of(userId, roomIdOrAlias, deviceId));
    }

    /**
     * 후보 서버 목록이 미리 채워진 요청으로 Peek 수행.
     *
     * @param context 취소 컨텍스트
     * @param request Peek 요청
     * @return 처리 결과
     * @throws IllegalArgumentException context 또는 request가 null인 경우
     */
    PeekResult performPeek(PeekContext context, PeekRequest request);
}
