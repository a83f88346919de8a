package com.rockpoint.payments.core;

import com.rockpoint.payments.core.http.GatewayNetworkException;
import com.rockpoint.payments.core.http.GatewayTimeoutException;
import com.rockpoint.payments.core.http.GatewayTransportException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRetrierTest {

    private static final RetryPolicy FAST = RetryPolicy.of(3, Duration.ofMillis(1), Duration.ofMillis(4));

    @Test
    void delayDoublesUpToCap() {
        RetryPolicy policy = RetryPolicy.of(5, Duration.ofSeconds(1), Duration.ofSeconds(5));

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayAfter(4)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.delayAfter(40)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void invalidPolicyIsRejected() {
        assertThatThrownBy(() -> RetryPolicy.of(0, Duration.ofSeconds(1), Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.of(3, Duration.ofSeconds(5), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void transportFailureIsRetriedUntilSuccess() {
        List<Integer> seen = new ArrayList<>();

        String result = BackoffRetrier.run("test", FAST, failed -> {
            seen.add(failed);
            if (failed < 2) {
                throw new GatewayNetworkException("reset", 1, null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(seen).containsExactly(0, 1, 2);
    }

    @Test
    void lastTransportFailureIsThrownAfterMaxAttempts() {
        List<Integer> seen = new ArrayList<>();

        assertThatThrownBy(() -> BackoffRetrier.run("test", FAST, failed -> {
            seen.add(failed);
            throw new GatewayTimeoutException(1000, 1001, null);
        }))
                .isInstanceOf(GatewayTransportException.class)
                .hasMessage("Request timeout after 1000ms");
        assertThat(seen).hasSize(3);
    }

    @Test
    void otherExceptionsAreNotRetried() {
        List<Integer> seen = new ArrayList<>();

        assertThatThrownBy(() -> BackoffRetrier.run("test", FAST, failed -> {
            seen.add(failed);
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(seen).containsExactly(0);
    }
}
