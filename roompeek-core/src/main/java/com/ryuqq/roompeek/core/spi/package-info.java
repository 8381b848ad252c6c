/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the peek flow depends on. Adapter modules
 * provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.roompeek.core.spi.DirectoryLookup} - Remote alias resolution</li>
 *   <li>{@link com.ryuqq.roompeek.core.spi.RoomDatabase} - Alias mappings and room state (read-only)</li>
 *   <li>{@link com.ryuqq.roompeek.core.spi.OutputEventStream} - Durable append-only event log</li>
 *   <li>{@link com.ryuqq.roompeek.core.spi.StateContentDecoder} - State event content decoding</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, file-backed or networked for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RoomPeek Team
 */
package com.ryuqq.roompeek.core.spi;
