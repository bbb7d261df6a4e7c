/**
 * Null-safe primitive predicates over untyped values.
 *
 * <p>Every check in {@link com.ryuqq.typeguard.core.predicate.Predicates} accepts any
 * {@code Object}, including {@code null}, and never throws. Numbers count only when finite.</p>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.core.predicate;
