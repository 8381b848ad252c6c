package com.ryuqq.roompeek.core.visibility;

/**
 * 히스토리 가시성 상태 이벤트의 콘텐츠.
 *
 * <p>historyVisibility가 null이면 콘텐츠에 {@code history_visibility} 키가 없다는 뜻입니다.</p>
 *
 * @param historyVisibility 가시성 원본 문자열 (키가 없으면 null)
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public record HistoryVisibilityContent(String historyVisibility) {

    public static HistoryVisibilityContent missingKey() {
        return new HistoryVisibilityContent(null);
    }

    public static HistoryVisibilityContent of(HistoryVisibility visibility) {
        return new HistoryVisibilityContent(visibility.value());
    }

    /**
     * 콘텐츠 평가.
     *
     * @return KEY_ABSENT, UNRECOGNIZED_VALUE, RESTRICTED, WORLD_READABLE 중 하나
     */
    public VisibilityCheck evaluate() {
        if (historyVisibility == null) {
            return VisibilityCheck.KEY_ABSENT;
        }
        return HistoryVisibility.fromValue(historyVisibility)
            .map(v -> v == HistoryVisibility.WORLD_READABLE ? VisibilityCheck.WORLD_READABLE : VisibilityCheck.RESTRICTED)
            .orElse(VisibilityCheck.UNRECOGNIZED_VALUE);
    }
}
