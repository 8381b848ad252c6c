package com.ryuqq.roompeek.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 페더레이션 재시도에 사용할 서버 이름 후보 목록.
 *
 * <p>순서가 곧 우선순위이며 중복을 허용합니다.
 * 추가만 가능하고, 기존 항목은 제거되거나 순서가 바뀌지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> {@link #append(String)}와 {@link #appendAll(List)}는
 * 항상 새 인스턴스를 반환하며 기존 인스턴스는 변경되지 않습니다.</p>
 *
 * <pre>
 * ServerNameCandidates candidates = ServerNameCandidates.empty()
 *     .append("remoteB")
 *     .appendAll(List.of("remoteC", "remoteB"));
 * candidates.asList(); // [remoteB, remoteC, remoteB]
 * </pre>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class ServerNameCandidates {

    private static final ServerNameCandidates EMPTY = new ServerNameCandidates(List.of());

    private final List<String> names;

    private ServerNameCandidates(List<String> names) {
        this.names = names;
    }

    /**
     * 빈 후보 목록.
     *
     * @return 빈 ServerNameCandidates
     */
    public static ServerNameCandidates empty() {
        return EMPTY;
    }

    /**
     * 기존 목록으로 생성.
     *
     * @param names 서버 이름 목록 (null이면 빈 목록)
     * @return ServerNameCandidates 인스턴스
     * @throws IllegalArgumentException 항목 중 null이 있는 경우
     */
    public static ServerNameCandidates of(List<String> names) {
        if (names == null || names.isEmpty()) {
            return EMPTY;
        }
        return new ServerNameCandidates(copyOf(names));
    }

    /**
     * 서버 이름 하나를 뒤에 추가.
     *
     * @param serverName 서버 이름
     * @return 추가된 새 인스턴스
     * @throws IllegalArgumentException serverName이 null인 경우
     */
    public ServerNameCandidates append(String serverName) {
        if (serverName == null) {
            throw new IllegalArgumentException("serverName cannot be null");
        }
        List<String> extended = new ArrayList<>(names.size() + 1);
        extended.addAll(names);
        extended.add(serverName);
        return new ServerNameCandidates(Collections.unmodifiableList(extended));
    }

    /**
     * 여러 서버 이름을 순서대로 뒤에 추가.
     *
     * @param serverNames 서버 이름 목록 (null 또는 빈 목록이면 그대로 반환)
     * @return 추가된 새 인스턴스
     * @throws IllegalArgumentException 항목 중 null이 있는 경우
     */
    public ServerNameCandidates appendAll(List<String> serverNames) {
        if (serverNames == null || serverNames.isEmpty()) {
            return this;
        }
        List<String> extended = new ArrayList<>(names.size() + serverNames.size());
        extended.addAll(names);
        extended.addAll(copyOf(serverNames));
        return new ServerNameCandidates(Collections.unmodifiableList(extended));
    }

    /**
     * 읽기 전용 목록 조회.
     *
     * @return 변경 불가능한 서버 이름 목록
     */
    public List<String> asList() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    private static List<String> copyOf(List<String> names) {
        for (String name : names) {
            if (name == null) {
                throw new IllegalArgumentException("server names cannot contain null");
            }
        }
        return List.copyOf(names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return names.equals(((ServerNameCandidates) o).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "ServerNameCandidates" + names;
    }
}
