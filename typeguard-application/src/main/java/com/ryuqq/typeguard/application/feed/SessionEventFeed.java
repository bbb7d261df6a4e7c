package com.ryuqq.typeguard.application.feed;

import com.ryuqq.typeguard.core.event.AuditEvent;
import com.ryuqq.typeguard.core.spi.AuditEventListener;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 세션 단위 최근 이벤트 피드.
 *
 * <p>레지스트리에 리스너로 등록되어 새 이벤트를 받으며, 최신 이벤트를 앞에 두고
 * 용량(기본 50)을 넘으면 가장 오래된 이벤트부터 버립니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SessionEventFeed feed = new SessionEventFeed();
 * registry.addListener(feed);
 * registry.create(input);
 * feed.events(); // [created]
 * </pre>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class SessionEventFeed implements AuditEventListener {

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<AuditEvent> events = new ArrayDeque<>();

    public SessionEventFeed() {
        this(DEFAULT_CAPACITY);
    }

    public SessionEventFeed(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void onEvent(AuditEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.addFirst(event);
        while (events.size() > capacity) {
            events.removeLast();
        }
    }

    /**
     * 보존 중인 이벤트 (최신순).
     *
     * @return 불변 목록
     */
    public synchronized List<AuditEvent> events() {
        return List.copyOf(new ArrayList<>(events));
    }

    public synchronized int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        events.clear();
    }
}
