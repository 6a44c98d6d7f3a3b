package com.yerin.jobclient.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JobStatus 어휘")
public class JobStatusTest {

    @Test
    @DisplayName("정확히 다섯 개의 상태 문자열")
    void vocabulary() {
        assertThat(Arrays.stream(JobStatus.values()).map(JobStatus::value))
                .containsExactly("queued", "started", "finished", "failed", "canceled");
    }

    @Test
    @DisplayName("문자열 → 상태, 모르는 값은 empty")
    void from_value() {
        assertThat(JobStatus.fromValue("started")).contains(JobStatus.STARTED);
        assertThat(JobStatus.fromValue("deferred")).isEmpty();
        assertThat(JobStatus.fromValue(null)).isEmpty();
    }

    @Test
    @DisplayName("종료 상태: finished, failed, canceled")
    void terminal_states() {
        assertThat(JobStatus.QUEUED.isTerminal()).isFalse();
        assertThat(JobStatus.STARTED.isTerminal()).isFalse();
        assertThat(JobStatus.FINISHED.isTerminal()).isTrue();
        assertThat(JobStatus.FAILED.isTerminal()).isTrue();
        assertThat(JobStatus.CANCELED.isTerminal()).isTrue();
    }
}
