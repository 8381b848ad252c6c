package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.error.PerformErrorCode;
import com.ryuqq.roompeek.core.error.PerformException;
import com.ryuqq.roompeek.core.spi.RoomDatabase;
import com.ryuqq.roompeek.core.spi.RoomDatabaseException;
import com.ryuqq.roompeek.core.spi.StateEvent;
import com.ryuqq.roompeek.core.visibility.HistoryVisibility;
import com.ryuqq.roompeek.core.visibility.VisibilityCheck;
import com.ryuqq.roompeek.json.jackson.JacksonStateContentDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * VisibilityGate 유닛 테스트.
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class VisibilityGateTest {

    private static final String ROOM = "!r1:serverA";

    @Mock
    private RoomDatabase roomDatabase;

    private VisibilityGate gate;

    @BeforeEach
    void setUp() {
        gate = new VisibilityGate(roomDatabase, new JacksonStateContentDecoder());
    }

    @Test
    void 이벤트가_없으면_RECORD_ABSENT() {
        when(roomDatabase.findStateEvent(any(), eq(ROOM), eq(HistoryVisibility.EVENT_TYPE), eq(HistoryVisibility.STATE_KEY)))
            .thenReturn(Optional.empty());

        assertThat(gate.check(PeekContext.background(), ROOM)).isEqualTo(VisibilityCheck.RECORD_ABSENT);
    }

    @Test
    void world_readable이면_허용() {
        stubContent("{\"history_visibility\":\"world_readable\"}");

        VisibilityCheck check = gate.check(PeekContext.background(), ROOM);

        assertThat(check).isEqualTo(VisibilityCheck.WORLD_READABLE);
        assertThat(check.permitsPeek()).isTrue();
    }

    @Test
    void shared면_RESTRICTED() {
        stubContent("{\"history_visibility\":\"shared\"}");

        assertThat(gate.check(PeekContext.background(), ROOM)).isEqualTo(VisibilityCheck.RESTRICTED);
    }

    @Test
    void 알_수_없는_값이면_UNRECOGNIZED_VALUE() {
        stubContent("{\"history_visibility\":\"everyone\"}");

        assertThat(gate.check(PeekContext.background(), ROOM)).isEqualTo(VisibilityCheck.UNRECOGNIZED_VALUE);
    }

    @Test
    void 숫자_값은_디코딩_실패로_INTERNAL() {
        stubContent("{\"history_visibility\":1}");

        assertThatThrownBy(() -> gate.check(PeekContext.background(), ROOM))
            .isInstanceOf(PerformException.class)
            .satisfies(e -> assertThat(((PerformException) e).code()).isEqualTo(PerformErrorCode.INTERNAL));
    }

    @Test
    void 저장소_실패는_INTERNAL로_래핑() {
        when(roomDatabase.findStateEvent(any(), eq(ROOM), any(), any()))
            .thenThrow(new RoomDatabaseException("disk error"));

        assertThatThrownBy(() -> gate.check(PeekContext.background(), ROOM))
            .isInstanceOf(PerformException.class)
            .hasMessage("Loading history visibility of room \"!r1:serverA\" failed: disk error");
    }

    private void stubContent(String content) {
        when(roomDatabase.findStateEvent(any(), eq(ROOM), eq(HistoryVisibility.EVENT_TYPE), eq(HistoryVisibility.STATE_KEY)))
            .thenReturn(Optional.of(new StateEvent(ROOM, HistoryVisibility.EVENT_TYPE, "", content)));
    }
}
