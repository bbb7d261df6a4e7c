/**
 * In-memory implementation of AuditLog SPI.
 *
 * <p>Bounded, append-only event log with oldest-first retention trimming.</p>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.adapter.inmemory.audit;
