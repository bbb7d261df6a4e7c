/**
 * Test fixtures: raw user inputs, deterministic ids and a settable clock.
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.testkit.fixture;
