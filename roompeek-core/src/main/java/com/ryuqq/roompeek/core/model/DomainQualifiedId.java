package com.ryuqq.roompeek.core.model;

/**
 * 도메인 한정 식별자 ({@code <sigil><localpart>:<domain>}).
 *
 * <p>사용자 ID, 룸 ID, 룸 별칭은 모두 같은 형식을 따르며,
 * 첫 번째 콜론(:)을 기준으로 localpart와 domain을 분리합니다.
 * domain 안의 콜론(포트 번호 등)은 그대로 유지됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * DomainQualifiedId id = DomainQualifiedId.parse(Sigil.ALIAS, "#pub:serverA");
 * id.localpart(); // "pub"
 * id.domain();    // "serverA"
 *
 * DomainQualifiedId.parse(Sigil.ROOM, "!r1:matrix.org:8448").domain(); // "matrix.org:8448"
 * </pre>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>지정한 시길로 시작해야 함</li>
 *   <li>콜론(:) 구분자 필수</li>
 *   <li>domain은 빈 문자열 불가</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class DomainQualifiedId {

    private final Sigil sigil;
    private final String localpart;
    private final String domain;

    private DomainQualifiedId(Sigil sigil, String localpart, String domain) {
        this.sigil = sigil;
        this.localpart = localpart;
        this.domain = domain;
    }

    /**
     * 식별자 문자열 파싱.
     *
     * @param sigil 기대하는 시길
     * @param value 식별자 문자열
     * @return 파싱된 DomainQualifiedId
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우 (메시지에 원인 포함)
     */
    public static DomainQualifiedId parse(Sigil sigil, String value) {
        if (sigil == null) {
            throw new IllegalArgumentException("sigil cannot be null");
        }
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("identifier cannot be null or empty");
        }
        if (!sigil.prefixes(value)) {
            throw new IllegalArgumentException(
                "invalid identifier " + quote(value) + ": expected sigil '" + sigil.symbol() + "'");
        }
        int separator = value.indexOf(':');
        if (separator < 0) {
            throw new IllegalArgumentException("invalid identifier " + quote(value) + ": missing ':' separator");
        }
        String domain = value.substring(separator + 1);
        if (domain.isEmpty()) {
            throw new IllegalArgumentException("invalid identifier " + quote(value) + ": empty domain");
        }
        return new DomainQualifiedId(sigil, value.substring(1, separator), domain);
    }

    public Sigil sigil() {
        return sigil;
    }

    public String localpart() {
        return localpart;
    }

    public String domain() {
        return domain;
    }

    /**
     * 이 식별자가 주어진 서버에 속하는지 확인.
     *
     * @param serverName 서버 이름
     * @return domain이 serverName과 같으면 true
     */
    public boolean belongsTo(String serverName) {
        return domain.equals(serverName);
    }

    /**
     * 원래 문자열 형태로 복원.
     *
     * @return {@code <sigil><localpart>:<domain>}
     */
    public String asString() {
        return sigil.symbol() + localpart + ":" + domain;
    }

    private static String quote(String value) {
        return "\"" + value + "\"";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DomainQualifiedId that = (DomainQualifiedId) o;
        return sigil == that.sigil && localpart.equals(that.localpart) && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        int result = sigil.hashCode();
        result = 31 * result + localpart.hashCode();
        result = 31 * result + domain.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "DomainQualifiedId{" + asString() + '}';
    }
}
