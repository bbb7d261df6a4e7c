/**
 * Reusable contract test base for UserRegistry implementations.
 *
 * <p>Concrete contract tests extend
 * {@link com.ryuqq.typeguard.testkit.contract.AbstractRegistryContractTest}; the suites in this
 * module's test tree run it against the in-memory adapters.</p>
 *
 * @since 1.0.0
 * @author TypeGuard Team
 */
package com.ryuqq.typeguard.testkit.contract;
