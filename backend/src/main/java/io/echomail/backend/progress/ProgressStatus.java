package io.echomail.backend.progress;

import java.util.Locale;

public enum ProgressStatus {
  SENDING,
  PAUSED,
  COMPLETED,
  ERROR,
  CANCELLED,
  UNKNOWN;

  /** Lower-case wire name, e.g. {@code "sending"}. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
