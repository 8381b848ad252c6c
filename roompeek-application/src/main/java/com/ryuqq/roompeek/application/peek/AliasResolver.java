package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.application.config.PeekConfig;
import com.ryuqq.roompeek.core.context.PeekCancelledException;
import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.contract.PeekRequest;
import com.ryuqq.roompeek.core.error.PerformException;
import com.ryuqq.roompeek.core.model.DomainQualifiedId;
import com.ryuqq.roompeek.core.model.ServerNameCandidates;
import com.ryuqq.roompeek.core.model.Sigil;
import com.ryuqq.roompeek.core.spi.DirectoryLookup;
import com.ryuqq.roompeek.core.spi.DirectoryLookupRequest;
import com.ryuqq.roompeek.core.spi.DirectoryLookupResponse;
import com.ryuqq.roompeek.core.spi.RoomDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 룸 별칭 → 정규 룸 ID 해석기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>별칭을 localpart와 domain으로 분리 (실패 시 BAD_REQUEST)</li>
 *   <li>별칭 domain을 후보 목록에 무조건 추가 (로컬이어도 추가)</li>
 *   <li>로컬 domain: RoomDatabase에서 조회</li>
 *   <li>원격 domain: DirectoryLookup에 위임하고, 응답의 서버 목록을 후보 목록 뒤에 추가</li>
 *   <li>룸 ID가 비어 있으면 INTERNAL ("not found")</li>
 * </ol>
 *
 * <p>요청 객체는 변경하지 않으며, 갱신된 후보 목록을 {@link AliasResolution}으로 반환합니다.
 * 룸 ID 단계로의 재진입은 호출자({@link RoomPeekOrchestrator})가 담당합니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class AliasResolver {

    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    private final PeekConfig config;
    private final RoomDatabase roomDatabase;
    private final DirectoryLookup directoryLookup;

    /**
     * 생성자.
     *
     * @param config 설정
     * @param roomDatabase 로컬 룸 저장소
     * @param directoryLookup 원격 디렉터리 조회
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AliasResolver(PeekConfig config, RoomDatabase roomDatabase, DirectoryLookup directoryLookup) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (roomDatabase == null) {
            throw new IllegalArgumentException("roomDatabase cannot be null");
        }
        if (directoryLookup == null) {
            throw new IllegalArgumentException("directoryLookup cannot be null");
        }
        this.config = config;
        this.roomDatabase = roomDatabase;
        this.directoryLookup = directoryLookup;
    }

    /**
     * 별칭 해석.
     *
     * @param context 취소 컨텍스트
     * @param request roomIdOrAlias가 별칭인 요청
     * @return 정규 룸 ID와 갱신된 후보 목록
     * @throws PerformException BAD_REQUEST (형식 오류) 또는 INTERNAL (조회 실패, 미발견)
     */
    public AliasResolution resolve(PeekContext context, PeekRequest request) {
        String alias = request.roomIdOrAlias();

        // 1. domain 분리
        DomainQualifiedId parsed;
        try {
            parsed = DomainQualifiedId.parse(Sigil.ALIAS, alias);
        } catch (IllegalArgumentException e) {
            throw PerformException.badRequest(String.format("Alias \"%s\" is not in the correct format", alias));
        }
        String domain = parsed.domain();

        // 2. 원격 조회 전에 후보 목록 시드
        ServerNameCandidates candidates = request.serverNames().append(domain);

        // 3. 로컬 / 원격 분기
        String roomId;
        if (config.isLocal(domain)) {
            roomId = lookupLocally(context, alias);
        } else {
            DirectoryLookupResponse response = lookupRemotely(context, alias, domain);
            roomId = response.roomId();
            candidates = candidates.appendAll(response.serverNames());
        }

        // 4. 미발견
        if (roomId == null || roomId.isEmpty()) {
            throw PerformException.internal(String.format("Alias \"%s\" not found", alias));
        }

        log.debug("Resolved alias {} to {} (candidates: {})", alias, roomId, candidates.asList());
        return new AliasResolution(roomId, candidates);
    }

    private String lookupLocally(PeekContext context, String alias) {
        context.throwIfDone();
        try {
            return roomDatabase.findRoomIdForAlias(context, alias).orElse("");
        } catch (PerformException | PeekCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw PerformException.internal(
                String.format("Lookup room alias \"%s\" failed: %s", alias, e.getMessage()), e);
        }
    }

    private DirectoryLookupResponse lookupRemotely(PeekContext context, String alias, String domain) {
        context.throwIfDone();
        DirectoryLookupResponse response;
        try {
            response = directoryLookup.lookup(context, new DirectoryLookupRequest(alias, domain));
        } catch (PerformException | PeekCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error looking up alias {} on {}", alias, domain, e);
            throw federationFailure(alias, domain, e.getMessage(), e);
        }
        if (response == null) {
            log.error("Directory lookup of alias {} on {} returned no response", alias, domain);
            throw federationFailure(alias, domain, "no response", null);
        }
        return response;
    }

    private static PerformException federationFailure(String alias, String domain, String reason, Throwable cause) {
        String msg = String.format("Looking up alias \"%s\" over federation from \"%s\" failed: %s", alias, domain, reason);
        return cause == null ? PerformException.internal(msg) : PerformException.internal(msg, cause);
    }
}
