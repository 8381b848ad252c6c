package com.ryuqq.roompeek.core.contract;

import com.ryuqq.roompeek.core.model.ServerNameCandidates;

/**
 * Peek 요청.
 *
 * <p>호출 한 번 동안만 존재하며 저장되지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>userId:</strong> 요청한 사용자 ID (로컬 서버 소속이어야 함)</li>
 *   <li><strong>roomIdOrAlias:</strong> 룸 ID 또는 별칭. 별칭이 해석되면 정규 ID로 한 번만 교체됨</li>
 *   <li><strong>deviceId:</strong> 요청한 디바이스 ID (빈 문자열 허용)</li>
 *   <li><strong>serverNames:</strong> 페더레이션 후보 서버 목록 (추가만 가능)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * PeekRequest request = PeekRequest.of("@alice:serverA", "#pub:serverA", "DEVICE1");
 * PeekRequest resolved = request
 *     .withRoomIdOrAlias("!room1:serverA")
 *     .withServerNames(request.serverNames().append("serverA"));
 * </pre>
 *
 * @param userId 사용자 ID
 * @param roomIdOrAlias 룸 ID 또는 별칭
 * @param deviceId 디바이스 ID
 * @param serverNames 페더레이션 후보 서버 목록
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record PeekRequest(
    String userId,
    String roomIdOrAlias,
    String deviceId,
    ServerNameCandidates serverNames
) {

    /**
     * Compact Constructor.
     *
     * <p>형식 검증은 하지 않습니다. null 식별자는 빈 문자열로 바꾸며,
     * 잘못된 형식과 마찬가지로 처리 단계에서 BAD_REQUEST로 보고됩니다.</p>
     */
    public PeekRequest {
        if (userId == null) {
            userId = "";
        }
        if (roomIdOrAlias == null) {
            roomIdOrAlias = "";
        }
        if (deviceId == null) {
            deviceId = "";
        }
        if (serverNames == null) {
            serverNames = ServerNameCandidates.empty();
        }
    }

    /**
     * 빈 후보 목록으로 요청 생성.
     *
     * @param userId 사용자 ID
     * @param roomIdOrAlias 룸 ID 또는 별칭
     * @param deviceId 디바이스 ID
     * @return PeekRequest
     */
    public static PeekRequest of(String userId, String roomIdOrAlias, String deviceId) {
        return new PeekRequest(userId, roomIdOrAlias, deviceId, ServerNameCandidates.empty());
    }

    /**
     * 룸 참조만 교체한 새 요청.
     *
     * @param roomId 정규 룸 ID
     * @return 새 PeekRequest
     */
    public PeekRequest withRoomIdOrAlias(String roomId) {
        return new PeekRequest(userId, roomId, deviceId, serverNames);
    }

    /**
     * 후보 목록만 교체한 새 요청.
     *
     * @param candidates 새 후보 목록
     * @return 새 PeekRequest
     */
    public PeekRequest withServerNames(ServerNameCandidates candidates) {
        return new PeekRequest(userId, roomIdOrAlias, deviceId, candidates);
    }
}
