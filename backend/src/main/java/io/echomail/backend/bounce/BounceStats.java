package io.echomail.backend.bounce;

/** Bounce counts, optionally scoped to one campaign. {@code bounceRate} is a percentage. */
public record BounceStats(
    long total,
    long hard,
    long soft,
    long complaints,
    long unsubscribes,
    double bounceRate,
    long suppressedCount) {

  public BounceStats withBounceRate(double bounceRate) {
    return new BounceStats(
        total, hard, soft, complaints, unsubscribes, bounceRate, suppressedCount);
  }
}
