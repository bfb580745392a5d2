package io.echomail.backend.dispatch;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single message within a dispatch run. {@code SUCCESS}, {@code ERROR}, {@code
 * SKIPPED} and {@code CANCELLED} are terminal.
 */
public enum DispatchStatus {
  PENDING,
  RETRYING,
  SUCCESS,
  ERROR,
  SKIPPED,
  CANCELLED;

  public boolean isTerminal() {
    return this == SUCCESS || this == ERROR || this == SKIPPED || this == CANCELLED;
  }

  public boolean canTransitionTo(DispatchStatus next) {
    return allowedTransitions().contains(next);
  }

  private Set<DispatchStatus> allowedTransitions() {
    return switch (this) {
      case PENDING -> EnumSet.of(RETRYING, SUCCESS, ERROR, SKIPPED, CANCELLED);
      case RETRYING -> EnumSet.of(RETRYING, SUCCESS, ERROR, CANCELLED);
      case SUCCESS, ERROR, SKIPPED, CANCELLED -> EnumSet.noneOf(DispatchStatus.class);
    };
  }
}
