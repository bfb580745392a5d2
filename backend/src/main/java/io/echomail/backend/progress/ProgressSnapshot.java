package io.echomail.backend.progress;

import java.time.Instant;

/** Point-in-time view of a campaign's aggregated progress. */
public record ProgressSnapshot(
    String campaignId,
    int sent,
    int failed,
    int total,
    ProgressStatus status,
    Instant startedAt,
    Instant lastUpdate) {

  public static ProgressSnapshot unknown(String campaignId) {
    return new ProgressSnapshot(campaignId, 0, 0, 0, ProgressStatus.UNKNOWN, null, null);
  }
}
