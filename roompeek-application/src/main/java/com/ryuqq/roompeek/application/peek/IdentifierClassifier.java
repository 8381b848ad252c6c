package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.core.error.PerformException;
import com.ryuqq.roompeek.core.model.ReferenceKind;

/**
 * 룸 참조 문자열 분류기.
 *
 * <p>첫 글자만 봅니다: {@code !}는 룸 ID, {@code #}는 별칭, 그 외는 잘못된 참조입니다.
 * 형식의 나머지 부분은 이후 단계에서 검증합니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class IdentifierClassifier {

    /**
     * 참조 분류.
     *
     * @param roomIdOrAlias 룸 ID 또는 별칭
     * @return ROOM_ID 또는 ROOM_ALIAS
     * @throws PerformException BAD_REQUEST - 비어 있거나 알 수 없는 형식인 경우
     */
    public ReferenceKind classify(String roomIdOrAlias) {
        for (ReferenceKind kind : ReferenceKind.values()) {
            if (kind.sigil().prefixes(roomIdOrAlias)) {
                return kind;
            }
        }
        throw PerformException.badRequest(
            String.format("Room ID or alias \"%s\" is invalid", roomIdOrAlias == null ? "" : roomIdOrAlias));
    }
}
