package com.rockpoint.payments.domain;

import org.junit.jupiter.api.Test;

import static com.rockpoint.payments.domain.TransactionStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class TransactionStatusTest {

    @Test
    void forwardMovesAreAllowed() {
        assertThat(PENDING.canTransitionTo(PROCESSING)).isTrue();
        assertThat(PENDING.canTransitionTo(FAILED)).isTrue();
        assertThat(PROCESSING.canTransitionTo(SUCCESS)).isTrue();
        assertThat(PROCESSING.canTransitionTo(FAILED)).isTrue();
        assertThat(SUCCESS.canTransitionTo(REVERSED)).isTrue();
    }

    @Test
    void skippingProcessingOrGoingBackIsRejected() {
        assertThat(PENDING.canTransitionTo(SUCCESS)).isFalse();
        assertThat(PROCESSING.canTransitionTo(PENDING)).isFalse();
        assertThat(SUCCESS.canTransitionTo(FAILED)).isFalse();
        assertThat(FAILED.canTransitionTo(PROCESSING)).isFalse();
        assertThat(REVERSED.allowedNext()).isEmpty();
        assertThat(PENDING.canTransitionTo(null)).isFalse();
    }
}
