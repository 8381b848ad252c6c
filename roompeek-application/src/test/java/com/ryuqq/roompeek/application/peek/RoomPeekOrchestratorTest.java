package com.ryuqq.roompeek.application.peek;

import com.ryuqq.roompeek.application.config.PeekConfig;
import com.ryuqq.roompeek.core.context.PeekContext;
import com.ryuqq.roompeek.core.contract.PeekRequest;
import com.ryuqq.roompeek.core.contract.PeekResult;
import com.ryuqq.roompeek.core.error.PerformErrorCode;
import com.ryuqq.roompeek.core.event.OutputEvent;
import com.ryuqq.roompeek.core.model.ServerNameCandidates;
import com.ryuqq.roompeek.core.spi.DirectoryLookup;
import com.ryuqq.roompeek.core.spi.DirectoryLookupException;
import com.ryuqq.roompeek.core.spi.DirectoryLookupRequest;
import com.ryuqq.roompeek.core.spi.DirectoryLookupResponse;
import com.ryuqq.roompeek.core.spi.OutputEventStream;
import com.ryuqq.roompeek.core.spi.OutputEventStreamException;
import com.ryuqq.roompeek.core.spi.RoomDatabase;
import com.ryuqq.roompeek.core.spi.RoomDatabaseException;
import com.ryuqq.roompeek.core.spi.StateEvent;
import com.ryuqq.roompeek.core.visibility.HistoryVisibility;
import com.ryuqq.roompeek.json.jackson.JacksonStateContentDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RoomPeekOrchestrator 유닛 테스트.
 *
 * <p>협력 컴포넌트는 모킹하고, 상태 콘텐츠 디코딩은 Jackson 구현을 그대로 사용합니다.</p>
 * <ul>
 *   <li>사용자 소속 검증 (I/O 이전)</li>
 *   <li>참조 분류 및 별칭 해석 분기 (로컬 / 원격)</li>
 *   <li>후보 서버 목록 누적</li>
 *   <li>가시성 정책</li>
 *   <li>NEW_PEEK 기록과 오류 변환</li>
 * </ul>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RoomPeekOrchestratorTest {

    private static final String LOCAL = "serverA";
    private static final String ALICE = "@alice:serverA";
    private static final String DEVICE = "DEVICE1";

    @Mock
    private RoomDatabase roomDatabase;

    @Mock
    private DirectoryLookup directoryLookup;

    @Mock
    private OutputEventStream outputEventStream;

    @Captor
    private ArgumentCaptor<List<OutputEvent>> eventsCaptor;

    private RoomPeekOrchestrator orchestrator;
    private PeekContext context;

    @BeforeEach
    void setUp() {
        orchestrator = RoomPeekOrchestrator.create(
            new PeekConfig(LOCAL),
            roomDatabase,
            directoryLookup,
            outputEventStream,
            new JacksonStateContentDecoder()
        );
        context = PeekContext.background();
    }

    // ============================================================
    // 1. 사용자 검증 (I/O 없음)
    // ============================================================

    @Test
    void 다른_서버_사용자면_BAD_REQUEST_협력자_호출_없음() {
        // when
        PeekResult result = orchestrator.performPeek(context, "@bob:other.org", "#pub:serverA", DEVICE);

        // then
        assertThat(result.isAccepted()).isFalse();
        assertThat(result.roomId()).isEmpty();
        assertThat(result.error().code()).isEqualTo(PerformErrorCode.BAD_REQUEST);
        assertThat(result.error().msg()).contains("does not belong to this homeserver");
        verifyNoInteractions(roomDatabase, directoryLookup, outputEventStream);
    }

    @Test
    void 사용자_ID_형식_오류면_BAD_REQUEST() {
        PeekResult result = orchestrator.performPeek(context, "alice", "!room1:serverA", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.BAD_REQUEST);
        assertThat(result.error().msg()).isEqualTo("Supplied user ID \"alice\" in incorrect format");
        verifyNoInteractions(roomDatabase, directoryLookup, outputEventStream);
    }

    @Test
    void 사용자_ID가_null이면_예외_없이_BAD_REQUEST() {
        PeekResult result = orchestrator.performPeek(context, null, "!r1:serverA", DEVICE);

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.error().code()).isEqualTo(PerformErrorCode.BAD_REQUEST);
        assertThat(result.error().msg()).isEqualTo("Supplied user ID \"\" in incorrect format");
        verifyNoInteractions(roomDatabase, directoryLookup, outputEventStream);
    }

    @Test
    void 룸_참조가_null이면_예외_없이_BAD_REQUEST() {
        PeekResult result = orchestrator.performPeek(context, ALICE, null, null);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.BAD_REQUEST);
        assertThat(result.error().msg()).isEqualTo("Room ID or alias \"\" is invalid");
        verifyNoInteractions(roomDatabase, directoryLookup, outputEventStream);
    }

    // ============================================================
    // 2. 참조 분류
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {"", "room1:serverA", "@alice:serverA", " !room1:serverA"})
    void 잘못된_참조면_BAD_REQUEST_부수효과_없음(String reference) {
        PeekResult result = orchestrator.performPeek(context, ALICE, reference, DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.BAD_REQUEST);
        assertThat(result.error().msg()).isEqualTo("Room ID or alias \"" + reference + "\" is invalid");
        verifyNoInteractions(roomDatabase, directoryLookup, outputEventStream);
    }

    @Test
    void 별칭_형식_오류면_BAD_REQUEST() {
        PeekResult result = orchestrator.performPeek(context, ALICE, "#nocolon", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.BAD_REQUEST);
        assertThat(result.error().msg()).contains("not in the correct format");
        verifyNoInteractions(roomDatabase, directoryLookup, outputEventStream);
    }

    @Test
    void 룸_ID_형식_오류면_BAD_REQUEST() {
        PeekResult result = orchestrator.performPeek(context, ALICE, "!nocolon", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.BAD_REQUEST);
        assertThat(result.error().msg()).startsWith("Room ID \"!nocolon\" is invalid");
        verifyNoInteractions(roomDatabase, directoryLookup, outputEventStream);
    }

    // ============================================================
    // 3. 로컬 별칭
    // ============================================================

    @Test
    void 로컬_별칭_world_readable이면_정규_ID로_수락하고_한건_기록() {
        // given
        when(roomDatabase.findRoomIdForAlias(any(), eq("#pub:serverA"))).thenReturn(Optional.of("!room1:serverA"));
        stubVisibility("!room1:serverA", "world_readable");

        // when
        PeekResult result = orchestrator.performPeek(context, ALICE, "#pub:serverA", DEVICE);

        // then
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.roomId()).isEqualTo("!room1:serverA");
        assertThat(result.error()).isNull();
        assertThat(result.serverNames()).containsExactly("serverA");

        verify(roomDatabase, times(1)).findRoomIdForAlias(any(), eq("#pub:serverA"));
        verify(outputEventStream, times(1)).append(any(), eq("!room1:serverA"), eventsCaptor.capture());
        assertThat(eventsCaptor.getValue())
            .containsExactly(OutputEvent.newPeek("!room1:serverA", ALICE, DEVICE));
        verifyNoInteractions(directoryLookup);
    }

    @Test
    void 로컬_별칭_미등록이면_INTERNAL_not_found() {
        when(roomDatabase.findRoomIdForAlias(any(), eq("#pub:serverA"))).thenReturn(Optional.empty());

        PeekResult result = orchestrator.performPeek(context, ALICE, "#pub:serverA", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.INTERNAL);
        assertThat(result.error().msg()).isEqualTo("Alias \"#pub:serverA\" not found");
        verify(roomDatabase, never()).findStateEvent(any(), anyString(), anyString(), anyString());
        verifyNoInteractions(directoryLookup, outputEventStream);
    }

    @Test
    void 로컬_별칭_조회_실패면_INTERNAL로_래핑() {
        when(roomDatabase.findRoomIdForAlias(any(), eq("#pub:serverA")))
            .thenThrow(new RoomDatabaseException("connection reset"));

        PeekResult result = orchestrator.performPeek(context, ALICE, "#pub:serverA", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.INTERNAL);
        assertThat(result.error().msg()).isEqualTo("Lookup room alias \"#pub:serverA\" failed: connection reset");
        assertThat(result.serverNames()).isEmpty();
        verifyNoInteractions(directoryLookup, outputEventStream);
    }

    // ============================================================
    // 4. 원격 별칭
    // ============================================================

    @Test
    void 원격_별칭은_디렉터리_조회_한번_후보_목록_확장() {
        // given
        DirectoryLookupRequest expected = new DirectoryLookupRequest("#x:remoteB", "remoteB");
        when(directoryLookup.lookup(any(), eq(expected)))
            .thenReturn(new DirectoryLookupResponse("!r9:remoteB", List.of("remoteC", "remoteB")));
        stubVisibility("!r9:remoteB", "world_readable");

        // when
        PeekResult result = orchestrator.performPeek(context, ALICE, "#x:remoteB", DEVICE);

        // then
        assertThat(result.roomId()).isEqualTo("!r9:remoteB");
        assertThat(result.serverNames()).containsExactly("remoteB", "remoteC", "remoteB", "remoteB");
        verify(directoryLookup, times(1)).lookup(any(), eq(expected));
        verify(roomDatabase, never()).findRoomIdForAlias(any(), anyString());
        verify(outputEventStream).append(any(), eq("!r9:remoteB"), eventsCaptor.capture());
        assertThat(eventsCaptor.getValue().get(0).newPeek().roomId()).isEqualTo("!r9:remoteB");
    }

    @Test
    void 원격_별칭_룸_ID가_비어있으면_INTERNAL_not_found() {
        when(directoryLookup.lookup(any(), any())).thenReturn(DirectoryLookupResponse.notFound());

        PeekResult result = orchestrator.performPeek(context, ALICE, "#x:remoteB", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.INTERNAL);
        assertThat(result.error().msg()).contains("not found");
        verify(roomDatabase, never()).findStateEvent(any(), anyString(), anyString(), anyString());
        verifyNoInteractions(outputEventStream);
    }

    @Test
    void 디렉터리_조회_실패면_별칭과_도메인을_담은_INTERNAL() {
        when(directoryLookup.lookup(any(), any())).thenThrow(new DirectoryLookupException("timeout"));

        PeekResult result = orchestrator.performPeek(context, ALICE, "#x:remoteB", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.INTERNAL);
        assertThat(result.error().msg())
            .contains("#x:remoteB")
            .contains("\"remoteB\"")
            .endsWith("timeout");
        verifyNoInteractions(roomDatabase, outputEventStream);
    }

    @Test
    void 미리_채워진_후보_목록은_순서_유지하며_뒤에_추가됨() {
        // given
        PeekRequest request = new PeekRequest(ALICE, "#x:remoteB", DEVICE,
            ServerNameCandidates.of(List.of("seed1", "seed2")));
        when(directoryLookup.lookup(any(), any()))
            .thenReturn(new DirectoryLookupResponse("!r9:remoteB", List.of("remoteC")));
        stubVisibility("!r9:remoteB", "world_readable");

        // when
        PeekResult result = orchestrator.performPeek(context, request);

        // then
        assertThat(result.serverNames()).containsExactly("seed1", "seed2", "remoteB", "remoteC", "remoteB");
        assertThat(request.serverNames().asList()).containsExactly("seed1", "seed2");
    }

    // ============================================================
    // 5. 가시성 정책
    // ============================================================

    @Test
    void 가시성_레코드가_없으면_NOT_ALLOWED() {
        when(roomDatabase.findStateEvent(any(), eq("!r1:serverA"), eq(HistoryVisibility.EVENT_TYPE), eq("")))
            .thenReturn(Optional.empty());

        PeekResult result = orchestrator.performPeek(context, ALICE, "!r1:serverA", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.NOT_ALLOWED);
        assertThat(result.error().msg()).isEqualTo("Room is not world-readable");
        assertThat(result.serverNames()).isEmpty();
        verifyNoInteractions(outputEventStream, directoryLookup);
    }

    @ParameterizedTest
    @ValueSource(strings = {"shared", "invited", "joined", "World_Readable", ""})
    void world_readable이_아닌_값이면_NOT_ALLOWED(String visibility) {
        stubVisibility("!r1:serverA", visibility);

        PeekResult result = orchestrator.performPeek(context, ALICE, "!r1:serverA", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.NOT_ALLOWED);
        verifyNoInteractions(outputEventStream);
    }

    @Test
    void 가시성_키가_없으면_NOT_ALLOWED() {
        when(roomDatabase.findStateEvent(any(), eq("!r1:serverA"), anyString(), anyString()))
            .thenReturn(Optional.of(new StateEvent("!r1:serverA", HistoryVisibility.EVENT_TYPE, "", "{\"other\":\"x\"}")));

        PeekResult result = orchestrator.performPeek(context, ALICE, "!r1:serverA", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.NOT_ALLOWED);
        verifyNoInteractions(outputEventStream);
    }

    @Test
    void 가시성_콘텐츠가_JSON_null이면_NOT_ALLOWED_기록_없음() {
        when(roomDatabase.findStateEvent(any(), eq("!r1:serverA"), anyString(), anyString()))
            .thenReturn(Optional.of(new StateEvent("!r1:serverA", HistoryVisibility.EVENT_TYPE, "", "null")));

        PeekResult result = orchestrator.performPeek(context, ALICE, "!r1:serverA", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.NOT_ALLOWED);
        assertThat(result.error().msg()).isEqualTo("Room is not world-readable");
        verifyNoInteractions(outputEventStream);
    }

    @Test
    void 가시성_디코딩_실패면_INTERNAL_기본값_대체_없음() {
        when(roomDatabase.findStateEvent(any(), eq("!r1:serverA"), anyString(), anyString()))
            .thenReturn(Optional.of(new StateEvent("!r1:serverA", HistoryVisibility.EVENT_TYPE, "", "not json")));

        PeekResult result = orchestrator.performPeek(context, ALICE, "!r1:serverA", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.INTERNAL);
        assertThat(result.error().msg()).startsWith("Decoding history visibility of room \"!r1:serverA\" failed");
        verifyNoInteractions(outputEventStream);
    }

    @Test
    void 원격_룸_ID는_후보_목록에_추가되고_로컬_상태로만_판단() {
        when(roomDatabase.findStateEvent(any(), eq("!r1:remoteB"), anyString(), anyString()))
            .thenReturn(Optional.empty());

        PeekResult result = orchestrator.performPeek(context, ALICE, "!r1:remoteB", DEVICE);

        assertThat(result.error().code()).isEqualTo(PerformErrorCode.NOT_ALLOWED);
        assertThat(result.serverNames()).containsExactly("remoteB");
        verifyNoInteractions(directoryLookup, outputEventStream);
    }

    // ============================================================
    // 6. 기록 및 오류 변환
    // ============================================================

    @Test
    void 같은_사용자가_두번_peek하면_두건_기록() {
        stubVisibility("!r1:serverA", "world_readable");

        orchestrator.performPeek(context, ALICE, "!r1:serverA", DEVICE);
        orchestrator.performPeek(context, ALICE, "!r1:serverA", DEVICE);

        verify(outputEventStream, times(2)).append(any(), eq("!r1:serverA"), anyList());
    }

    @Test
    void 출력_스트림_실패는_원래_메시지로_INTERNAL() {
        stubVisibility("!r1:serverA", "world_readable");
        doThrow(new OutputEventStreamException("stream unavailable"))
            .when(outputEventStream).append(any(), anyString(), anyList());

        PeekResult result = orchestrator.performPeek(context, ALICE, "!r1:serverA", DEVICE);

        assertThat(result.roomId()).isEmpty();
        assertThat(result.error().code()).isEqualTo(PerformErrorCode.INTERNAL);
        assertThat(result.error().msg()).isEqualTo("stream unavailable");
    }

    @Test
    void 취소된_컨텍스트면_INTERNAL_기록_없음() {
        // given
        PeekContext cancelled = PeekContext.background();
        cancelled.cancel("client disconnected");

        // when
        PeekResult result = orchestrator.performPeek(cancelled, ALICE, "#pub:serverA", DEVICE);

        // then
        assertThat(result.error().code()).isEqualTo(PerformErrorCode.INTERNAL);
        assertThat(result.error().msg()).isEqualTo("Peek cancelled: client disconnected");
        verifyNoInteractions(roomDatabase, directoryLookup, outputEventStream);
    }

    @Test
    void 가시성_확인_중_취소되면_기록하지_않음() {
        // given
        PeekContext cancellable = PeekContext.background();
        when(roomDatabase.findStateEvent(any(), eq("!r1:serverA"), anyString(), anyString()))
            .thenAnswer(invocation -> {
                cancellable.cancel("deadline");
                return Optional.of(worldReadable("!r1:serverA", "world_readable"));
            });

        // when
        PeekResult result = orchestrator.performPeek(cancellable, ALICE, "!r1:serverA", DEVICE);

        // then
        assertThat(result.error().code()).isEqualTo(PerformErrorCode.INTERNAL);
        verifyNoInteractions(outputEventStream);
    }

    private void stubVisibility(String roomId, String visibility) {
        when(roomDatabase.findStateEvent(any(), eq(roomId), eq(HistoryVisibility.EVENT_TYPE), eq("")))
            .thenReturn(Optional.of(worldReadable(roomId, visibility)));
    }

    private static StateEvent worldReadable(String roomId, String visibility) {
        return new StateEvent(roomId, HistoryVisibility.EVENT_TYPE, "",
            "{\"history_visibility\":\"" + visibility + "\"}");
    }
}
