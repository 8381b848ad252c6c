package com.ryuqq.roompeek.core.error;

/**
 * {@link PerformError}를 발생 지점부터 운반하는 예외.
 *
 * <p>오류가 처음 감지된 지점에서 코드와 메시지를 확정하므로,
 * 상위 계층은 예외 종류를 검사하지 않고 {@link #error()}만 꺼내 쓰면 됩니다.</p>
 *
 * <pre>
 * throw PerformException.badRequest("Room ID or alias \"foo\" is invalid");
 *
 * throw PerformException.internal("Lookup room alias \"#a:b\" failed: " + e.getMessage(), e);
 * </pre>
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class PerformException extends RuntimeException {

    private final transient PerformError error;

    public PerformException(PerformError error) {
        this(error, null);
    }

    public PerformException(PerformError error, Throwable cause) {
        super(requireError(error).msg(), cause);
        this.error = error;
    }

    public static PerformException badRequest(String msg) {
        return new PerformException(PerformError.badRequest(msg));
    }

    public static PerformException notAllowed(String msg) {
        return new PerformException(PerformError.notAllowed(msg));
    }

    public static PerformException internal(String msg) {
        return new PerformException(PerformError.internal(msg));
    }

    public static PerformException internal(String msg, Throwable cause) {
        return new PerformException(PerformError.internal(msg), cause);
    }

    /**
     * 운반 중인 오류 조회.
     *
     * @return PerformError
     */
    public PerformError error() {
        return error;
    }

    public PerformErrorCode code() {
        return error.code();
    }

    private static PerformError requireError(PerformError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error;
    }
}
