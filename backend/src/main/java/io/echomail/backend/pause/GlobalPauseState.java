package io.echomail.backend.pause;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of the process-wide dispatch pause.
 *
 * @param paused whether dispatch is currently paused
 * @param reason why the pause was triggered, null when not paused
 * @param pausedAt when the pause started
 * @param pausedUntil when the pause lifts on its own
 * @param remaining time left until {@code pausedUntil}, zero when not paused
 */
public record GlobalPauseState(
    boolean paused, String reason, Instant pausedAt, Instant pausedUntil, Duration remaining) {

  public static GlobalPauseState inactive() {
    return new GlobalPauseState(false, null, null, null, Duration.ZERO);
  }
}
