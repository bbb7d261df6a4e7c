/**
 * In-memory implementation of UserRepository SPI.
 *
 * <p>This package provides a thread-safe, insertion-ordered document store for testing
 * and single-process use.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li><strong>Insertion Order:</strong> findAll returns documents oldest-first; replacement keeps position</li>
 *   <li><strong>Copy Semantics:</strong> Deep unmodifiable copies stored, top-level copies returned</li>
 *   <li><strong>Thread Safety:</strong> synchronized methods</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.adapter.inmemory.repository;
