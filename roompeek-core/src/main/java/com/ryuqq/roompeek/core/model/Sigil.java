package com.ryuqq.roompeek.core.model;

/**
 * 도메인 한정 식별자의 첫 글자(시길).
 *
 * <p>식별자의 종류는 첫 글자로만 구분됩니다:</p>
 * <ul>
 *   <li>{@link #USER}: 사용자 ID (예: {@code @alice:example.org})</li>
 *   <li>{@link #ROOM}: 정규 룸 ID (예: {@code !abc123:example.org})</li>
 *   <li>{@link #ALIAS}: 룸 별칭 (예: {@code #general:example.org})</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public enum Sigil {

    USER('@'),
    ROOM('!'),
    ALIAS('#');

    private final char symbol;

    Sigil(char symbol) {
        this.symbol = symbol;
    }

    /**
     * 시길 문자 조회.
     *
     * @return 시길 문자
     */
    public char symbol() {
        return symbol;
    }

    /**
     * 문자열이 이 시길로 시작하는지 확인.
     *
     * @param value 검사할 문자열 (null 허용)
     * @return 시길로 시작하면 true
     */
    public boolean prefixes(String value) {
        return value != null && !value.isEmpty() && value.charAt(0) == symbol;
    }
}
