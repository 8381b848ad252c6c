package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.application.config.PeekConfig;
import com.ryuqq.roompeek.core.context.PeekCancelledException;
import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.contract.PeekRequest;
import com.ryuqq.roompeek.core.contract.PeekResult;
import com.ryuqq.roompeek.core.error.PerformError;
import com.ryuqq.roompeek.core.error.PerformException;
import com.ryuqq.roompeek.core.model.DomainQualifiedId;
import com.ryuqq.roompeek.core.model.ReferenceKind;
import com.ryuqq.roompeek.core.model.Sigil;
import com.ryuqq.roompeek.core.spi.DirectoryLookup;
import com.ryuqq.roompeek.core.spi.OutputEventStream;
import com.ryuqq.roompeek.core.spi.RoomDatabase;
import com.ryuqq.roompeek.core.spi.StateContentDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PeekOrchestrator} 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>사용자 ID 분리, 로컬 서버 소속 확인 (I/O 전에 수행, 실패 시 BAD_REQUEST)</li>
 *   <li>룸 참조 분류 ({@link IdentifierClassifier})</li>
 *   <li>별칭이면 {@link AliasResolver}로 정규 ID를 얻고 요청을 교체</li>
 *   <li>{@link RoomIdResolver}로 가시성 검사 및 기록</li>
 *   <li>모든 실패를 {@link PerformError}로 변환해 결과에 담음</li>
 * </ol>
 *
 * <p><strong>오류 변환:</strong></p>
 * <ul>
 *   <li>{@link PerformException}: 담긴 오류 그대로 사용</li>
 *   <li>{@link PeekCancelledException}: INTERNAL ("Peek cancelled: ...")</li>
 *   <li>그 외 RuntimeException (예: 출력 스트림 실패): INTERNAL, 원래 메시지 유지</li>
 * </ul>
 *
 * <p>상태를 갖지 않으므로 여러 스레드에서 동시에 호출해도 안전합니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class RoomPeekOrchestrator implements PeekOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RoomPeekOrchestrator.class);

    private final PeekConfig config;
    private final IdentifierClassifier classifier;
    private final AliasResolver aliasResolver;
    private final RoomIdResolver roomIdResolver;

    /**
     * 생성자 (구성 요소 직접 주입).
     *
     * @param config 설정
     * @param classifier 참조 분류기
     * @param aliasResolver 별칭 해석기
     * @param roomIdResolver 룸 ID 처리기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RoomPeekOrchestrator(
        PeekConfig config,
        IdentifierClassifier classifier,
        AliasResolver aliasResolver,
        RoomIdResolver roomIdResolver
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (aliasResolver == null) {
            throw new IllegalArgumentException("aliasResolver cannot be null");
        }
        if (roomIdResolver == null) {
            throw new IllegalArgumentException("roomIdResolver cannot be null");
        }
        this.config = config;
        this.classifier = classifier;
        this.aliasResolver = aliasResolver;
        this.roomIdResolver = roomIdResolver;
    }

    /**
     * SPI 구현체로 전체 구성 요소를 조립.
     *
     * @param config 설정
     * @param roomDatabase 로컬 룸 저장소
     * @param directoryLookup 원격 디렉터리 조회
     * @param outputEventStream 출력 이벤트 스트림
     * @param decoder 상태 콘텐츠 디코더
     * @return RoomPeekOrchestrator
     */
    public static RoomPeekOrchestrator create(
        PeekConfig config,
        RoomDatabase roomDatabase,
        DirectoryLookup directoryLookup,
        OutputEventStream outputEventStream,
        StateContentDecoder decoder
    ) {
        return new RoomPeekOrchestrator(
            config,
            new IdentifierClassifier(),
            new AliasResolver(config, roomDatabase, directoryLookup),
            new RoomIdResolver(config, new VisibilityGate(roomDatabase, decoder), new PeekRecorder(outputEventStream))
        );
    }

    /**
     * 설정의 기본 기한을 적용한 컨텍스트로 Peek 수행.
     *
     * @param userId 사용자 ID
     * @param roomIdOrAlias 룸 ID 또는 별칭
     * @param deviceId 디바이스 ID
     * @return 처리 결과
     */
    public PeekResult performPeek(String userId, String roomIdOrAlias, String deviceId) {
        return performPeek(PeekContext.withTimeout(config.defaultTimeoutMs()), userId, roomIdOrAlias, deviceId);
    }

    @Override
    public PeekResult performPeek(PeekContext context, PeekRequest request) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        PeekRequest current = request;
        try {
            validateUser(request.userId());

            if (classifier.classify(request.roomIdOrAlias()) == ReferenceKind.ROOM_ALIAS) {
                AliasResolution resolution = aliasResolver.resolve(context, request);
                current = request
                    .withRoomIdOrAlias(resolution.roomId())
                    .withServerNames(resolution.serverNames());
            }

            PeekResult result = roomIdResolver.resolve(context, current);
            if (result.isAccepted()) {
                log.debug("Accepted peek of {} by {} ({})", result.roomId(), request.userId(), request.roomIdOrAlias());
            }
            return result;

        } catch (PerformException e) {
            return failed(e.error(), current);
        } catch (PeekCancelledException e) {
            log.warn("Peek of {} by {} cancelled: {}", request.roomIdOrAlias(), request.userId(), e.getMessage());
            return failed(PerformError.internal("Peek cancelled: " + e.getMessage()), current);
        } catch (RuntimeException e) {
            log.error("Peek of {} by {} failed", current.roomIdOrAlias(), request.userId(), e);
            return failed(PerformError.internal(messageOf(e)), current);
        }
    }

    /**
     * 사용자 ID 검증 (I/O 없음).
     *
     * @param userId 사용자 ID
     * @throws PerformException BAD_REQUEST - 형식 오류 또는 다른 서버 소속인 경우
     */
    private void validateUser(String userId) {
        DomainQualifiedId parsed;
        try {
            parsed = DomainQualifiedId.parse(Sigil.USER, userId);
        } catch (IllegalArgumentException e) {
            throw PerformException.badRequest(String.format("Supplied user ID \"%s\" in incorrect format", userId));
        }
        if (!config.isLocal(parsed.domain())) {
            throw PerformException.badRequest(String.format("User \"%s\" does not belong to this homeserver", userId));
        }
    }

    private static PeekResult failed(PerformError error, PeekRequest request) {
        return PeekResult.failed(error, request.serverNames().asList());
    }

    private static String messageOf(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
