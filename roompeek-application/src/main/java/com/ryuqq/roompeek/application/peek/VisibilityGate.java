package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.core.context.PeekCancelledException;
import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.error.PerformException;
import com.ryuqq.roompeek.core.spi.RoomDatabase;
import com.ryuqq.roompeek.core.spi.StateContentDecodeException;
import com.ryuqq.roompeek.core.spi.StateContentDecoder;
import com.ryuqq.roompeek.core.spi.StateEvent;
import com.ryuqq.roompeek.core.visibility.HistoryVisibility;
import com.ryuqq.roompeek.core.visibility.VisibilityCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 히스토리 가시성 검사기.
 *
 * <p>룸의 {@code m.room.history_visibility} 상태 이벤트를 읽어 비회원 peek 허용 여부를 판단합니다.</p>
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>이벤트 없음 → RECORD_ABSENT (오류 아님, 닫힘)</li>
 *   <li>디코딩 실패 → INTERNAL (기본값으로 대체하지 않음)</li>
 *   <li>키 없음 → KEY_ABSENT</li>
 *   <li>{@code world_readable} → WORLD_READABLE (유일한 허용)</li>
 *   <li>그 외 → RESTRICTED 또는 UNRECOGNIZED_VALUE</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class VisibilityGate {

    private static final Logger log = LoggerFactory.getLogger(VisibilityGate.class);

    private final RoomDatabase roomDatabase;
    private final StateContentDecoder decoder;

    public VisibilityGate(RoomDatabase roomDatabase, StateContentDecoder decoder) {
        if (roomDatabase == null) {
            throw new IllegalArgumentException("roomDatabase cannot be null");
        }
        if (decoder == null) {
            throw new IllegalArgumentException("decoder cannot be null");
        }
        this.roomDatabase = roomDatabase;
        this.decoder = decoder;
    }

    /**
     * 룸 가시성 검사.
     *
     * @param context 취소 컨텍스트
     * @param roomId 정규 룸 ID
     * @return 검사 결과 (부수 효과 없음)
     * @throws PerformException INTERNAL - 저장소 조회 또는 디코딩 실패 시
     */
    public VisibilityCheck check(PeekContext context, String roomId) {
        Optional<StateEvent> event = fetch(context, roomId);
        if (event.isEmpty()) {
            return VisibilityCheck.RECORD_ABSENT;
        }
        try {
            return decoder.decodeHistoryVisibility(event.get().content()).evaluate();
        } catch (StateContentDecodeException e) {
            log.error("Decoding history visibility of {} failed", roomId, e);
            throw PerformException.internal(
                String.format("Decoding history visibility of room \"%s\" failed: %s", roomId, e.getMessage()), e);
        }
    }

    private Optional<StateEvent> fetch(PeekContext context, String roomId) {
        context.throwIfDone();
        try {
            return roomDatabase.findStateEvent(context, roomId, HistoryVisibility.EVENT_TYPE, HistoryVisibility.STATE_KEY);
        } catch (PerformException | PeekCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw PerformException.internal(
                String.format("Loading history visibility of room \"%s\" failed: %s", roomId, e.getMessage()), e);
        }
    }
}
