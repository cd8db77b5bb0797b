package com.fallacylens.infrastructure.ai.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget for one analysis, read through an injected {@link Clock}.
 */
public final class AnalysisDeadline {

    private final Clock clock;
    private final Instant expiresAt;

    private AnalysisDeadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static AnalysisDeadline start(Clock clock, Duration budget) {
        return new AnalysisDeadline(clock, clock.instant().plus(budget));
    }

    public long remainingMs() {
        return Math.max(0, Duration.between(clock.instant(), expiresAt).toMillis());
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public Instant expiresAt() {
        return expiresAt;
    }
}
