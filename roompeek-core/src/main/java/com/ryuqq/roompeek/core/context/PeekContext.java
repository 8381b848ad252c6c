package com.ryuqq.roompeek.core.context;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * 호출자가 제공하는 취소/기한 컨텍스트.
 *
 * <p>Peek 호출 하나에 하나씩 만들어지며, 모든 협력 컴포넌트 호출에 전달됩니다.
 * 취소되었거나 기한이 지나면 {@link #throwIfDone()}이 {@link PeekCancelledException}을 던집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PeekContext context = PeekContext.withTimeout(2_000);
 * PeekResult result = orchestrator.performPeek(context, userId, alias, deviceId);
 *
 * // 다른 스레드에서 취소
 * context.cancel("client disconnected");
 * </pre>
 *
 * <p><strong>Thread-safety:</strong> {@link #cancel(String)}은 다른 스레드에서 호출해도 안전합니다.</p>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public final class PeekContext {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long deadlineNanos;
    private final LongSupplier nanoClock;
    private final AtomicReference<String> cancelReason = new AtomicReference<>();

    private PeekContext(long deadlineNanos, LongSupplier nanoClock) {
        this.deadlineNanos = deadlineNanos;
        this.nanoClock = nanoClock;
    }

    /**
     * 기한 없는 컨텍스트 생성.
     *
     * @return PeekContext
     */
    public static PeekContext background() {
        return new PeekContext(NO_DEADLINE, System::nanoTime);
    }

    /**
     * 기한이 있는 컨텍스트 생성.
     *
     * @param timeoutMs 기한 (밀리초, 0이면 기한 없음)
     * @return PeekContext
     * @throws IllegalArgumentException timeoutMs가 음수인 경우
     */
    public static PeekContext withTimeout(long timeoutMs) {
        return withTimeout(timeoutMs, System::nanoTime);
    }

    /**
     * 시계를 지정해 기한이 있는 컨텍스트 생성 (테스트용).
     *
     * @param timeoutMs 기한 (밀리초, 0이면 기한 없음)
     * @param nanoClock 나노초 시계
     * @return PeekContext
     * @throws IllegalArgumentException timeoutMs가 음수이거나 nanoClock이 null인 경우
     */
    public static PeekContext withTimeout(long timeoutMs, LongSupplier nanoClock) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be non-negative (current: " + timeoutMs + ")");
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        if (timeoutMs == 0) {
            return new PeekContext(NO_DEADLINE, nanoClock);
        }
        return new PeekContext(nanoClock.getAsLong() + TimeUnit.MILLISECONDS.toNanos(timeoutMs), nanoClock);
    }

    /**
     * 컨텍스트 취소. 처음 호출만 유효합니다.
     *
     * @param reason 취소 사유
     */
    public void cancel(String reason) {
        cancelReason.compareAndSet(null, reason == null || reason.isBlank() ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return cancelReason.get() != null;
    }

    public boolean isDeadlineExceeded() {
        return deadlineNanos != NO_DEADLINE && nanoClock.getAsLong() - deadlineNanos >= 0;
    }

    /**
     * 취소 또는 기한 초과 여부.
     *
     * @return 더 이상 작업을 진행하면 안 되면 true
     */
    public boolean isDone() {
        return isCancelled() || isDeadlineExceeded();
    }

    /**
     * 남은 시간 조회.
     *
     * @return 남은 시간 (밀리초). 기한이 없으면 {@link Long#MAX_VALUE}, 지났으면 0
     */
    public long remainingMillis() {
        if (deadlineNanos == NO_DEADLINE) {
            return Long.MAX_VALUE;
        }
        long remaining = deadlineNanos - nanoClock.getAsLong();
        return remaining <= 0 ? 0 : TimeUnit.NANOSECONDS.toMillis(remaining);
    }

    /**
     * 취소되었거나 기한이 지났으면 예외 발생.
     *
     * @throws PeekCancelledException 취소 또는 기한 초과 시
     */
    public void throwIfDone() {
        String reason = cancelReason.get();
        if (reason != null) {
            throw new PeekCancelledException(reason);
        }
        if (isDeadlineExceeded()) {
            throw new PeekCancelledException("deadline exceeded");
        }
    }
}
