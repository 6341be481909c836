package dev.factories.scheduler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerStatesTest {

    @ParameterizedTest
    @CsvSource({
        "PENDING, PENDING",
        "REQUEUED, PENDING",
        "CONFIGURING, STARTING",
        "RUNNING, RUNNING",
        "running, RUNNING",
        "COMPLETING, COMPLETED",
        "COMPLETED, COMPLETED",
        "TIMEOUT, FAILED",
        "NODE_FAIL, FAILED",
        "OUT_OF_MEMORY, FAILED",
        "CANCELLED, CANCELED",
        "'CANCELLED by 1234', CANCELED",
        "node-fail, FAILED",
    })
    void mapsKnownStates(String raw, JobState expected) {
        assertThat(SchedulerStates.map(raw)).isEqualTo(expected);
    }

    @Test
    void emptyResultMeansTheJobIsGone() {
        assertThat(SchedulerStates.map("")).isEqualTo(JobState.COMPLETED);
        assertThat(SchedulerStates.map(null)).isEqualTo(JobState.COMPLETED);
    }

    @Test
    void unrecognisedStateIsNeitherRunningNorTerminal() {
        JobState state = SchedulerStates.map("SPECIAL_EXIT");

        assertThat(state).isEqualTo(JobState.UNKNOWN);
        assertThat(state.isTerminal()).isFalse();
    }
}
