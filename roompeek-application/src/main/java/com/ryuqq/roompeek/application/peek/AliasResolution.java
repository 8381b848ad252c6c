package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.core.model.ServerNameCandidates;

/**
 * 별칭 해석 결과.
 *
 * @param roomId 해석된 정규 룸 ID
 * @param serverNames 별칭 domain과 디렉터리 조회 결과가 추가된 후보 목록
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record AliasResolution(String roomId, ServerNameCandidates serverNames) {
}
