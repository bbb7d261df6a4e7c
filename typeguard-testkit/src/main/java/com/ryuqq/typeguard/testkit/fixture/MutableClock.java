package com.ryuqq.typeguard.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} whose current instant is set by the test.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
 * registry.create(input);             // createdAt = 2024-01-01T00:00:00Z
 * clock.advance(Duration.ofMinutes(5));
 * registry.update(id, Map.of("age", 31)); // updatedAt = 2024-01-01T00:05:00Z
 * </pre>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    public static final Instant DEFAULT_START = Instant.parse("2024-01-01T00:00:00Z");

    private final ZoneId zone;
    private volatile Instant instant;

    public MutableClock() {
        this(DEFAULT_START);
    }

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.instant = start;
        this.zone = zone;
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        this.instant = instant;
    }

    /**
     * Moves the clock by the given amount. Negative durations move it backwards.
     *
     * @param duration amount to move
     */
    public synchronized void advance(Duration duration) {
        this.instant = instant.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
