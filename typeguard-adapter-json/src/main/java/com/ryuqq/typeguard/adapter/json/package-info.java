/**
 * Jackson boundary for the user registry.
 *
 * <p>{@link com.ryuqq.typeguard.adapter.json.UserJsonApi} parses request bodies into untyped
 * documents, delegates to the registry and renders every outcome as an
 * {@link com.ryuqq.typeguard.adapter.json.ApiResponse} envelope with an HTTP status.</p>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.adapter.json;
