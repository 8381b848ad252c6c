package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.application.config.PeekConfig;
import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.contract.PeekRequest;
import com.ryuqq.roompeek.core.contract.PeekResult;
import com.ryuqq.roompeek.core.error.PerformError;
import com.ryuqq.roompeek.core.error.PerformException;
import com.ryuqq.roompeek.core.model.DomainQualifiedId;
import com.ryuqq.roompeek.core.model.ServerNameCandidates;
import com.ryuqq.roompeek.core.model.Sigil;
import com.ryuqq.roompeek.core.visibility.VisibilityCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 정규 룸 ID 기반 peek 처리.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>룸 ID를 localpart와 domain으로 분리 (실패 시 BAD_REQUEST)</li>
 *   <li>domain이 로컬이 아니면 후보 목록에 추가 (원격 호출은 하지 않음)</li>
 *   <li>{@link VisibilityGate}로 가시성 검사, world_readable이 아니면 NOT_ALLOWED 결과 반환 (기록 없음)</li>
 *   <li>{@link PeekRecorder}로 NEW_PEEK 기록 (실패는 그대로 전파)</li>
 *   <li>정규 룸 ID 반환</li>
 * </ol>
 *
 * <p>원격 룸은 후보 목록만 채우고 가시성은 로컬 저장소로만 판단합니다.
 * 로컬에 상태가 없는 원격 룸은 항상 거부됩니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class RoomIdResolver {

    private static final Logger log = LoggerFactory.getLogger(RoomIdResolver.class);

    private final PeekConfig config;
    private final VisibilityGate visibilityGate;
    private final PeekRecorder peekRecorder;

    public RoomIdResolver(PeekConfig config, VisibilityGate visibilityGate, PeekRecorder peekRecorder) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (visibilityGate == null) {
            throw new IllegalArgumentException("visibilityGate cannot be null");
        }
        if (peekRecorder == null) {
            throw new IllegalArgumentException("peekRecorder cannot be null");
        }
        this.config = config;
        this.visibilityGate = visibilityGate;
        this.peekRecorder = peekRecorder;
    }

    /**
     * 룸 ID로 peek 처리.
     *
     * @param context 취소 컨텍스트
     * @param request roomIdOrAlias가 정규 룸 ID인 요청
     * @return 수락 결과, 또는 가시성 정책에 따른 NOT_ALLOWED 결과 (둘 다 최종 후보 목록 포함)
     * @throws PerformException BAD_REQUEST (형식 오류) 또는 INTERNAL (저장소/디코딩 실패)
     */
    public PeekResult resolve(PeekContext context, PeekRequest request) {
        String roomId = request.roomIdOrAlias();

        DomainQualifiedId parsed;
        try {
            parsed = DomainQualifiedId.parse(Sigil.ROOM, roomId);
        } catch (IllegalArgumentException e) {
            throw PerformException.badRequest(String.format("Room ID \"%s\" is invalid: %s", roomId, e.getMessage()));
        }

        ServerNameCandidates candidates = request.serverNames();
        if (!config.isLocal(parsed.domain())) {
            candidates = candidates.append(parsed.domain());
            // TODO: ask candidate servers for the room state once federated peeks are replicated
            log.debug("Room {} is owned by {}; checking visibility against local state only", roomId, parsed.domain());
        }

        VisibilityCheck check = visibilityGate.check(context, roomId);
        if (!check.permitsPeek()) {
            log.info("Rejected peek of {} by {}: {}", roomId, request.userId(), check);
            return PeekResult.failed(PerformError.notAllowed("Room is not world-readable"), candidates.asList());
        }

        peekRecorder.record(context, roomId, request.userId(), request.deviceId());
        return PeekResult.accepted(roomId, candidates.asList());
    }
}
