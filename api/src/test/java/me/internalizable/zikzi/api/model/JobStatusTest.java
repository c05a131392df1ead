package me.internalizable.zikzi.api.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusTest {

    @Test
    void receivedMovesToProcessingOrFailsDirectly() {
        assertThat(JobStatus.RECEIVED.canAdvanceTo(JobStatus.PROCESSING)).isTrue();
        assertThat(JobStatus.RECEIVED.canAdvanceTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.RECEIVED.canAdvanceTo(JobStatus.COMPLETED)).isFalse();
        assertThat(JobStatus.RECEIVED.canAdvanceTo(JobStatus.RECEIVED)).isFalse();
    }

    @Test
    void processingMovesToEitherTerminalState() {
        assertThat(JobStatus.PROCESSING.canAdvanceTo(JobStatus.COMPLETED)).isTrue();
        assertThat(JobStatus.PROCESSING.canAdvanceTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.PROCESSING.canAdvanceTo(JobStatus.RECEIVED)).isFalse();
    }

    @Test
    void terminalStatesNeverMove() {
        for (JobStatus next : JobStatus.values()) {
            assertThat(JobStatus.COMPLETED.canAdvanceTo(next)).isFalse();
            assertThat(JobStatus.FAILED.canAdvanceTo(next)).isFalse();
        }
    }
}
