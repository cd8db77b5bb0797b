package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.support.FakeClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisDeadlineTest {

    @Test
    @DisplayName("Remaining time follows the clock and never goes negative")
    void remaining() {
        FakeClock clock = new FakeClock();
        AnalysisDeadline deadline = AnalysisDeadline.start(clock, Duration.ofSeconds(10));

        assertThat(deadline.remainingMs()).isEqualTo(10_000);
        assertThat(deadline.isExpired()).isFalse();

        clock.advance(Duration.ofSeconds(4));
        assertThat(deadline.remainingMs()).isEqualTo(6_000);

        clock.advance(Duration.ofSeconds(6));
        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remainingMs()).isZero();

        clock.advance(Duration.ofSeconds(5));
        assertThat(deadline.remainingMs()).isZero();
    }
}
