package io.echomail.backend.bounce;

import java.util.List;

/** Partition of a recipient list into addresses that may be sent to and suppressed ones. */
public record EligibilityResult(List<String> eligible, List<String> suppressed) {

  public EligibilityResult {
    eligible = List.copyOf(eligible);
    suppressed = List.copyOf(suppressed);
  }
}
