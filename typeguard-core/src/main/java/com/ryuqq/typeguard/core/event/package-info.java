/**
 * Audit events and their document form.
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.core.event;
