/**
 * Inbound request and result contracts of the peek entry point.
 *
 * @since 1.0.0
 * @author RoomPeek Team
 */
package com.ryuqq.roompeek.core.contract;
