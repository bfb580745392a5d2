package io.echomail.backend.pause;

public record GlobalPauseResponse(boolean isPaused, long pauseTimeRemaining, String reason) {

  public static GlobalPauseResponse from(GlobalPauseState state) {
    return new GlobalPauseResponse(
        state.paused(), state.remaining().toMillis(), state.reason());
  }
}
