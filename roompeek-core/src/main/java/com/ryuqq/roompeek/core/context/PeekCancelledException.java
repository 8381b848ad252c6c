package com.ryuqq.roompeek.core.context;

/**
 * 취소되었거나 기한이 지난 {@link PeekContext}에서 작업을 계속하려 할 때 발생.
 *
 * @author RoomPeek Team
 * @since 1.0.0
 */
public class PeekCancelledException extends RuntimeException {

    public PeekCancelledException(String message) {
        super(message);
    }
}
