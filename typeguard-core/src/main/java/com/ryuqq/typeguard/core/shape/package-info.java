/**
 * Record shapes: field-by-field validation that narrows untyped documents.
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.core.shape;
