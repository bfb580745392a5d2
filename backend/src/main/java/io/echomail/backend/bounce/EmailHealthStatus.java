package io.echomail.backend.bounce;

import java.time.Instant;

/**
 * Deliverability verdict for one address, derived from its bounce history and the suppression
 * list.
 */
public record EmailHealthStatus(
    String address,
    boolean valid,
    int bounceCount,
    BounceType lastBounceType,
    Instant lastBounceDate,
    boolean shouldSuppress,
    String suppressionReason) {

  public static EmailHealthStatus clean(String address) {
    return new EmailHealthStatus(address, true, 0, null, null, false, null);
  }
}
