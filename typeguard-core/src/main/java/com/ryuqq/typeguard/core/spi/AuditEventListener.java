package com.ryuqq.typeguard.core.spi;

import com.ryuqq.typeguard.core.event.AuditEvent;

/**
 * Receives audit events after they have been appended to the log.
 *
 * <p>Listeners are called synchronously while the store's lock is held,
 * so they must not block or call back into the store.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AuditEventListener {

    void onEvent(AuditEvent event);
}
