/**
 * Error taxonomy for peek resolution.
 *
 * <p>{@link com.ryuqq.roompeek.core.error.PerformError} is the only error shape returned to callers.
 * {@link com.ryuqq.roompeek.core.error.PerformException} carries it from the point of origin
 * up to the orchestrator boundary.</p>
 *
 * @since 1.0.0
 * @author RoomPeek Team
 */
package com.ryuqq.roompeek.core.error;
