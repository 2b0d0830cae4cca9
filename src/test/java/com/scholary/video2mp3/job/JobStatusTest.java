package com.scholary.video2mp3.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class JobStatusTest {

  @Test
  void terminalStates_shouldBeReadyFailedAndExpired() {
    assertThat(JobStatus.READY.isTerminal()).isTrue();
    assertThat(JobStatus.FAILED.isTerminal()).isTrue();
    assertThat(JobStatus.EXPIRED.isTerminal()).isTrue();
    assertThat(JobStatus.QUEUED.isTerminal()).isFalse();
    assertThat(JobStatus.DOWNLOADING.isActive()).isTrue();
    assertThat(JobStatus.TRANSCODING.isActive()).isTrue();
  }

  @Test
  void successPath_shouldOnlyMoveForward() {
    assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.DOWNLOADING)).isTrue();
    assertThat(JobStatus.DOWNLOADING.canTransitionTo(JobStatus.TRANSCODING)).isTrue();
    assertThat(JobStatus.TRANSCODING.canTransitionTo(JobStatus.READY)).isTrue();

    assertThat(JobStatus.TRANSCODING.canTransitionTo(JobStatus.DOWNLOADING)).isFalse();
    assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.READY)).isFalse();
    assertThat(JobStatus.READY.canTransitionTo(JobStatus.QUEUED)).isFalse();
  }

  @Test
  void activeStates_shouldBeAbleToFail() {
    assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.FAILED)).isTrue();
    assertThat(JobStatus.DOWNLOADING.canTransitionTo(JobStatus.FAILED)).isTrue();
    assertThat(JobStatus.TRANSCODING.canTransitionTo(JobStatus.FAILED)).isTrue();
    assertThat(JobStatus.READY.canTransitionTo(JobStatus.FAILED)).isFalse();
  }

  @Test
  void retry_shouldOnlyBeAllowedFromFailedOrExpired() {
    for (JobStatus status : JobStatus.values()) {
      boolean expected = status == JobStatus.FAILED || status == JobStatus.EXPIRED;
      assertThat(status.isRetryable()).as(status.value()).isEqualTo(expected);
      assertThat(status.canTransitionTo(JobStatus.QUEUED)).as(status.value()).isEqualTo(expected);
    }
  }

  @Test
  void expired_shouldOnlyBeReachedFromReady() {
    for (JobStatus status : JobStatus.values()) {
      assertThat(status.canTransitionTo(JobStatus.EXPIRED))
          .as(status.value())
          .isEqualTo(status == JobStatus.READY);
    }
  }

  @Test
  void fromValue_shouldParseStoredValues() {
    assertThat(JobStatus.fromValue("transcoding")).isEqualTo(JobStatus.TRANSCODING);
    assertThat(JobStatus.fromValue(" READY ")).isEqualTo(JobStatus.READY);
    assertThatThrownBy(() -> JobStatus.fromValue("done"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
