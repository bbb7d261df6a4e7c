/**
 * Narrowed domain model.
 *
 * <p>Instances are produced by the shapes in {@code com.ryuqq.typeguard.core.shape}
 * and are therefore always valid:</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.typeguard.core.model.User} - Stored entity</li>
 *   <li>{@link com.ryuqq.typeguard.core.model.ContactInfo} - Email, optional phone and address</li>
 *   <li>{@link com.ryuqq.typeguard.core.model.Address} - Postal address, all fields required</li>
 * </ul>
 *
 * <h2>Roles</h2>
 * <p>{@link com.ryuqq.typeguard.core.model.RoleUser} wraps a user with role-specific fields:
 * {@link com.ryuqq.typeguard.core.model.AdminUser} carries permissions and an optional last login,
 * {@link com.ryuqq.typeguard.core.model.RegularUser} an optional
 * {@link com.ryuqq.typeguard.core.model.Subscription}.</p>
 *
 * <h2>Documents</h2>
 * <p>{@link com.ryuqq.typeguard.core.model.Documents} freezes untyped documents so that
 * stored and published values cannot be mutated by callers.</p>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.core.model;
