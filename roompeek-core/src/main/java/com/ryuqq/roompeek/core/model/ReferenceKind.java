package com.ryuqq.roompeek.core.model;

/**
 * 룸 참조 문자열의 종류.
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public enum ReferenceKind {

    /** 정규 룸 ID ({@code !}로 시작). */
    ROOM_ID(Sigil.ROOM),

    /** 룸 별칭 ({@code #}로 시작). */
    ROOM_ALIAS(Sigil.ALIAS);

    private final Sigil sigil;

    ReferenceKind(Sigil sigil) {
        this.sigil = sigil;
    }

    public Sigil sigil() {
        return sigil;
    }
}
