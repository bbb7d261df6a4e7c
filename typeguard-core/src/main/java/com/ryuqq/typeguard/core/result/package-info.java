/**
 * Explicit success / failure outcomes.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.typeguard.core.result.Result} - Success or Failure, never both</li>
 *   <li>{@link com.ryuqq.typeguard.core.result.AppError} - Validation, network or business error</li>
 *   <li>{@link com.ryuqq.typeguard.core.result.ErrorCodes} - Stable machine-readable codes</li>
 * </ul>
 *
 * <p>Expected failures are returned, not thrown.</p>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.core.result;
