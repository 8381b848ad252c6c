/**
 * Core value objects for room references and federation candidates.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.roompeek.core.model.DomainQualifiedId} - {@code <sigil><localpart>:<domain>} identifier</li>
 *   <li>{@link com.ryuqq.roompeek.core.model.Sigil} - Identifier kind by first character</li>
 *   <li>{@link com.ryuqq.roompeek.core.model.ReferenceKind} - Room ID or room alias</li>
 *   <li>{@link com.ryuqq.roompeek.core.model.ServerNameCandidates} - Append-only federation server list</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Factory validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RoomPeek Team
 */
package com.ryuqq.roompeek.core.model;
