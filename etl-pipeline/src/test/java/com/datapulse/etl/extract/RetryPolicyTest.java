package com.datapulse.etl.extract;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    void linearBackoffGrowsWithAttemptIndex() {
        RetryPolicy policy = RetryPolicy.builder().baseDelay(Duration.ofMillis(100)).build();

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(300));
    }

    @Test
    void exponentialBackoffDoublesAndIsCapped() {
        RetryPolicy policy = RetryPolicy.builder()
                .baseDelay(Duration.ofMillis(100))
                .backoff(RetryPolicy.Backoff.EXPONENTIAL)
                .maxDelay(Duration.ofMillis(500))
                .build();

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.delayAfter(4)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void defaultsAreThreeAttemptsWithOneSecondLinearBackoff() {
        RetryPolicy policy = RetryPolicy.builder().build();

        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.getBackoff()).isEqualTo(RetryPolicy.Backoff.LINEAR);
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofSeconds(2));
    }
}
