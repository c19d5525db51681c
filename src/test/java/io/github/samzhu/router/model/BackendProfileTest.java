package io.github.samzhu.router.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BackendProfileTest {

    private final BackendProfile base = new BackendProfile("DeepSeek", "https://deepseek.internal/v1/chat",
        HealthState.UP, 80, 0.001, 200, 100, true, 30, 4, 0);

    @Test
    void successUpdatesRollingAverage() {
        BackendProfile updated = base.withSuccess(700);

        assertThat(updated.totalRequests()).isEqualTo(5);
        assertThat(updated.avgLatencyMs()).isEqualTo(300.0);
        assertThat(updated.successRate()).isEqualTo(100.0);
    }

    @Test
    void failureLowersSuccessRateOnly() {
        BackendProfile updated = base.withFailure();

        assertThat(updated.totalRequests()).isEqualTo(5);
        assertThat(updated.failedRequests()).isEqualTo(1);
        assertThat(updated.successRate()).isEqualTo(80.0);
        assertThat(updated.avgLatencyMs()).isEqualTo(200.0);
    }

    @Test
    void healthUpdateKeepsLatencyWhenProbeFailed() {
        assertThat(base.withHealth(HealthState.DOWN, null).avgLatencyMs()).isEqualTo(200.0);
        assertThat(base.withHealth(HealthState.DOWN, null).isAvailable()).isFalse();
        assertThat(base.withHealth(HealthState.DEGRADED, 50L).isAvailable()).isTrue();
    }

    @Test
    void rejectsInvalidProfiles() {
        assertThatThrownBy(() -> new BackendProfile("X", "ftp://x", HealthState.UP, 50, 0, 0, 100, true, 30, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackendProfile("X", "http://x", HealthState.UP, 101, 0, 0, 100, true, 30, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackendProfile("X", "http://x", HealthState.UP, 50, -1, 0, 100, true, 30, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
