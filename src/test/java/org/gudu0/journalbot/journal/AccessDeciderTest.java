package org.gudu0.journalbot.journal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessDeciderTest {

    @ParameterizedTest(name = "{0} total={1} boundary={2} -> {3}")
    @CsvSource({
            "LOCKED,   0,   false, HOLD",
            "LOCKED,   499, false, HOLD",
            "LOCKED,   500, false, GRANT",
            "LOCKED,   900, false, GRANT",
            "UNLOCKED, 500, false, HOLD",
            "UNLOCKED, 900, false, HOLD",
            "UNLOCKED, 100, false, HOLD",
            "LOCKED,   0,   true,  REVOKE",
            "LOCKED,   900, true,  REVOKE",
            "UNLOCKED, 0,   true,  REVOKE",
            "UNLOCKED, 900, true,  REVOKE",
    })
    void decidesEveryCombination(AccessState state, long total, boolean boundary, AccessDecision expected) {
        assertThat(AccessDecider.decide(state, total, 500, boundary)).isEqualTo(expected);
    }

    @Test
    void everyStateTotalAndThresholdYieldsTheExpectedDecision() {
        int[] thresholds = {1, 2, 500, Integer.MAX_VALUE};
        for (int threshold : thresholds) {
            long[] totals = {0, threshold - 1L, threshold, threshold + 1L, 2L * threshold};
            for (long total : totals) {
                if (total < 0) continue;
                for (AccessState state : AccessState.values()) {
                    assertThat(AccessDecider.decide(state, total, threshold, true))
                            .as("%s total=%d threshold=%d boundary", state, total, threshold)
                            .isEqualTo(AccessDecision.REVOKE);

                    AccessDecision expected = state == AccessState.LOCKED && total >= threshold
                            ? AccessDecision.GRANT
                            : AccessDecision.HOLD;
                    assertThat(AccessDecider.decide(state, total, threshold, false))
                            .as("%s total=%d threshold=%d", state, total, threshold)
                            .isEqualTo(expected);
                }
            }
        }
    }

    @Test
    void withoutBoundaryDefaultsToNotFired() {
        assertThat(AccessDecider.decide(AccessState.LOCKED, 500, 500)).isEqualTo(AccessDecision.GRANT);
    }

    @Test
    void missingStateIsRejected() {
        assertThatThrownBy(() -> AccessDecider.decide(null, 10, 500, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
