package com.ryuqq.typeguard.adapter.inmemory.audit;

import com.ryuqq.typeguard.core.model.Documents;
import com.ryuqq.typeguard.core.spi.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory, capacity-bounded implementation of {@link AuditLog} SPI.
 *
 * <p>Entries are kept in an {@link ArrayDeque}, oldest at the head. When an append pushes the size
 * past {@link #capacity()}, entries are removed from the head until the last {@code capacity}
 * entries remain.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * AuditLog log = new InMemoryAuditLog(100);
 * log.append(AuditEventDocuments.toDocument(event));
 * List&lt;Map&lt;String, Object&gt;&gt; entries = log.entries(); // oldest first
 * </pre>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public class InMemoryAuditLog implements AuditLog {

    /**
     * Default number of retained events.
     */
    public static final int DEFAULT_CAPACITY = 100;

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditLog.class);

    private final int capacity;
    private final Deque<Map<String, Object>> entries = new ArrayDeque<>();
    private long trimmed;

    public InMemoryAuditLog() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a log that retains at most {@code capacity} entries.
     *
     * @param capacity maximum retained entries
     * @throws IllegalArgumentException if capacity is not positive
     */
    public InMemoryAuditLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void append(Map<String, Object> eventDocument) {
        if (eventDocument == null) {
            throw new IllegalArgumentException("eventDocument cannot be null");
        }
        entries.addLast(Documents.freeze(eventDocument));
        while (entries.size() > capacity) {
            entries.removeFirst();
            trimmed++;
            log.debug("Audit log over capacity {}, discarded oldest entry ({} discarded so far)", capacity, trimmed);
        }
    }

    @Override
    public synchronized List<Map<String, Object>> entries() {
        List<Map<String, Object>> copies = new ArrayList<>(entries.size());
        for (Map<String, Object> entry : entries) {
            copies.add(new LinkedHashMap<>(entry));
        }
        return copies;
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * Number of entries discarded by retention trimming since creation or the last {@link #clear()}.
     *
     * @return discarded entry count
     */
    public synchronized long trimmedCount() {
        return trimmed;
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        trimmed = 0;
    }
}
