package com.ryuqq.typeguard.core.spi;

import java.util.List;
import java.util.Map;

/**
 * Append-only audit log SPI.
 *
 * <p>Entries are untyped event documents ({@code {type, timestamp, data}}). Entries are never
 * modified or removed individually; the only removal is retention trimming: once more than
 * {@link #capacity()} entries are held, the oldest are discarded so that the last
 * {@code capacity} entries remain.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe</li>
 *   <li>Entries are stored and returned as copies</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public interface AuditLog {

    /**
     * Appends an event document, trimming the oldest entries if capacity is exceeded.
     *
     * @param eventDocument the event document
     * @throws IllegalArgumentException if eventDocument is null
     */
    void append(Map<String, Object> eventDocument);

    /**
     * Returns copies of the retained entries.
     *
     * @return entries, oldest first
     */
    List<Map<String, Object>> entries();

    int size();

    int capacity();

    void clear();
}
