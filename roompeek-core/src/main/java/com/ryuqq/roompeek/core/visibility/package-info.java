/**
 * History visibility schema.
 *
 * <p>A visibility check has five distinct outcomes
 * ({@link com.ryuqq.roompeek.core.visibility.VisibilityCheck}); only {@code WORLD_READABLE} permits a peek.
 * A room without a visibility record is closed.</p>
 *
 * @since 1.0.0
 * @author RoomPeek Team
 */
package com.ryuqq.roompeek.core.visibility;
