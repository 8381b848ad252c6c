package com.ryuqq.roompeek.application.config;

/**
 * Peek 처리 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>serverName: 로컬 서버 이름. 사용자/별칭/룸 ID의 domain과 비교됩니다</li>
 *   <li>defaultTimeoutMs: 컨텍스트 없이 호출될 때 적용할 기한 (기본 5000ms, 0은 기한 없음)</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 * @param serverName 로컬 서버 이름 (빈 문자열 불가)
 * @param defaultTimeoutMs 기본 기한 (밀리초, 0 이상)
 */
public record PeekConfig(String serverName, long defaultTimeoutMs) {

    private static final long DEFAULT_TIMEOUT_MS = 5000;

    /**
     * 기본 기한(5000ms)으로 생성.
     *
     * @param serverName 로컬 서버 이름
     */
    public PeekConfig(String serverName) {
        this(serverName, DEFAULT_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PeekConfig {
        if (serverName == null || serverName.isBlank()) {
            throw new IllegalArgumentException("serverName cannot be null or blank");
        }
        if (serverName.indexOf(':') == 0) {
            throw new IllegalArgumentException("serverName cannot start with ':' (current: " + serverName + ")");
        }
        if (defaultTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "defaultTimeoutMs must be non-negative (current: " + defaultTimeoutMs + ")"
            );
        }
    }

    /**
     * defaultTimeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param defaultTimeoutMs 새로운 기본 기한 (밀리초)
     * @return 새 PeekConfig 인스턴스
     */
    public PeekConfig withDefaultTimeoutMs(long defaultTimeoutMs) {
        return new PeekConfig(this.serverName, defaultTimeoutMs);
    }

    /**
     * 주어진 domain이 로컬 서버인지 확인.
     *
     * @param domain 식별자의 domain
     * @return 로컬 서버면 true
     */
    public boolean isLocal(String domain) {
        return serverName.equals(domain);
    }
}
