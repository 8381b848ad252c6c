package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.event.OutputEvent;
import com.ryuqq.roompeek.core.spi.OutputEventStream;

import java.util.List;

/**
 * 수락된 peek을 출력 스트림에 기록.
 *
 * <p>호출마다 NEW_PEEK 이벤트 하나를 append 한 번으로 기록합니다.
 * 중복 방지는 하지 않으며, 같은 사용자가 같은 룸을 두 번 peek하면 두 건이 기록됩니다.</p>
 *
 * <p>스트림의 예외는 래핑하지 않고 그대로 전파합니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class PeekRecorder {

    private final OutputEventStream outputEventStream;

    public PeekRecorder(OutputEventStream outputEventStream) {
        if (outputEventStream == null) {
            throw new IllegalArgumentException("outputEventStream cannot be null");
        }
        this.outputEventStream = outputEventStream;
    }

    /**
     * NEW_PEEK 이벤트 기록.
     *
     * @param context 취소 컨텍스트 (취소되었으면 아무것도 기록하지 않음)
     * @param roomId 정규 룸 ID
     * @param userId 사용자 ID
     * @param deviceId 디바이스 ID
     * @throws com.ryuqq.roompeek.core.context.PeekCancelledException 컨텍스트가 종료된 경우
     * @throws RuntimeException 스트림 append 실패 시 (래핑 없이 전파)
     */
    public void record(PeekContext context, String roomId, String userId, String deviceId) {
        context.throwIfDone();
        outputEventStream.append(context, roomId, List.of(OutputEvent.newPeek(roomId, userId, deviceId)));
    }
}
