package com.landingzone.orchestrator.support;

import com.landingzone.orchestrator.engine.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Manually advanced clock. {@link #sleeper()} advances it instead of
 * blocking, so polling loops run instantly in tests.
 */
public class FakeClock extends Clock {

    private Instant now;
    private final List<Duration> sleeps = new ArrayList<>();

    public FakeClock() {
        this(Instant.parse("2024-06-01T06:00:00Z"));
    }

    public FakeClock(Instant start) {
        this.now = start;
    }

    public void advance(Duration d) {
        now = now.plus(d);
    }

    public Sleeper sleeper() {
        return d -> {
            sleeps.add(d);
            advance(d);
        };
    }

    /** Every duration passed to {@link #sleeper()}, in order. */
    public List<Duration> sleeps() {
        return sleeps;
    }

    @Override public Instant instant()           { return now; }
    @Override public ZoneId  getZone()           { return ZoneOffset.UTC; }
    @Override public Clock   withZone(ZoneId z)  { return this; }
}
