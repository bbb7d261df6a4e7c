/**
 * Throwing counterparts of the predicates and shapes.
 *
 * <p>{@link com.ryuqq.typeguard.core.assertion.TypeAssertions} returns the narrowed value or
 * raises {@link com.ryuqq.typeguard.core.assertion.TypeAssertionException}.</p>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.core.assertion;
