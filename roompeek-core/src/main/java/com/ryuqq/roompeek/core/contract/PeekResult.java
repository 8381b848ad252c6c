package com.ryuqq.roompeek.core.contract;

import com.ryuqq.roompeek.core.error.PerformError;

import java.util.List;

/**
 * Peek 처리 결과.
 *
 * <p>성공 시 roomId는 정규 룸 ID이고 error는 null입니다.
 * 실패 시 roomId는 빈 문자열이고 error가 채워집니다.</p>
 *
 * <p>serverNames는 처리 중 누적된 페더레이션 후보 서버 목록으로,
 * 실패한 경우에도 그 시점까지 누적된 목록을 담습니다.</p>
 *
 * @param roomId 정규 룸 ID (실패 시 빈 문자열)
 * @param error 오류 (성공 시 null)
 * @param serverNames 페더레이션 후보 서버 목록
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record PeekResult(
    String roomId,
    PerformError error,
    List<String> serverNames
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 성공 결과의 roomId가 비어 있는 경우
     */
    public PeekResult {
        if (roomId == null) {
            roomId = "";
        }
        if (error == null && roomId.isEmpty()) {
            throw new IllegalArgumentException("roomId cannot be empty for a successful result");
        }
        serverNames = serverNames == null ? List.of() : List.copyOf(serverNames);
    }

    public static PeekResult accepted(String roomId, List<String> serverNames) {
        return new PeekResult(roomId, null, serverNames);
    }

    public static PeekResult failed(PerformError error, List<String> serverNames) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new PeekResult("", error, serverNames);
    }

    /**
     * 성공 여부 확인.
     *
     * @return error가 없으면 true
     */
    public boolean isAccepted() {
        return error == null;
    }
}
