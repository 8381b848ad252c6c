/**
 * Peek resolution flow.
 *
 * <p>{@link com.ryuqq.roompeek.application.peek.RoomPeekOrchestrator} validates the user, classifies the
 * room reference and drives {@link com.ryuqq.roompeek.application.peek.AliasResolver},
 * {@link com.ryuqq.roompeek.application.peek.RoomIdResolver},
 * {@link com.ryuqq.roompeek.application.peek.VisibilityGate} and
 * {@link com.ryuqq.roompeek.application.peek.PeekRecorder} in that order.</p>
 *
 * @since 1.0.0
 * @author RoomPeek Team
 */
package com.ryuqq.roompeek.application.peek;
