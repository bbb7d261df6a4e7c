/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage ports the entity store depends on.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.typeguard.core.spi.UserRepository} - Untyped user documents keyed by id</li>
 *   <li>{@link com.ryuqq.typeguard.core.spi.AuditLog} - Append-only, capacity-bounded event log</li>
 *   <li>{@link com.ryuqq.typeguard.core.spi.AuditEventListener} - Notification after each append</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., typeguard-adapter-inmemory) provide concrete implementations.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Untyped Storage:</strong> Adapters store documents, the store narrows every read</li>
 *   <li><strong>Copy Semantics:</strong> No adapter hands out its live internal state</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.core.spi;
