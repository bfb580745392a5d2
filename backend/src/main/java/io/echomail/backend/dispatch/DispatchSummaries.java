package io.echomail.backend.dispatch;

import java.util.Collection;

/** Builds the one-line summaries reported at the end of a dispatch run or chunk. */
public final class DispatchSummaries {

  private DispatchSummaries() {}

  public static String describe(HaltReason reason, Collection<SendOutcome> outcomes) {
    long sent = count(outcomes, DispatchStatus.SUCCESS);
    long failed = count(outcomes, DispatchStatus.ERROR);
    long skipped = count(outcomes, DispatchStatus.SKIPPED);
    long cancelled = count(outcomes, DispatchStatus.CANCELLED);
    return switch (reason) {
      case COMPLETED -> String.format("Done: %d sent, %d failed", sent, failed);
      case STOPPED_ON_ERROR ->
          String.format("Stopped: %d sent, %d failed, %d skipped", sent, failed, skipped);
      case RATE_LIMITED ->
          String.format(
              "Paused (rate limit): %d sent, %d failed, %d skipped", sent, failed, skipped);
      case CANCELLED -> String.format("Cancelled: %d sent, %d cancelled", sent, cancelled);
    };
  }

  private static long count(Collection<SendOutcome> outcomes, DispatchStatus status) {
    return outcomes.stream().filter(o -> o.getStatus() == status).count();
  }
}
