package io.echomail.backend.progress;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Mutable progress of one campaign. Counts are derived from a ledger keyed by submission, so
 * reporting the same chunk or message twice replaces the earlier tally instead of adding to it.
 */
final class CampaignProgress {

  private record Tally(int sent, int failed) {}

  private final String campaignId;
  private final Instant startedAt;
  private final Map<String, Tally> ledger = new HashMap<>();
  private int total;
  private ProgressStatus status = ProgressStatus.SENDING;
  private Instant lastUpdate;

  CampaignProgress(String campaignId, int total, Instant startedAt) {
    this.campaignId = campaignId;
    this.total = total;
    this.startedAt = startedAt;
    this.lastUpdate = startedAt;
  }

  synchronized void record(String submissionKey, int sent, int failed, Instant at) {
    if (sent == 0 && failed == 0) {
      ledger.remove(submissionKey);
    } else {
      ledger.put(submissionKey, new Tally(sent, failed));
    }
    lastUpdate = at;
  }

  synchronized void expandTotal(int total) {
    this.total = Math.max(this.total, total);
  }

  synchronized void setStatus(ProgressStatus status, Instant at) {
    this.status = status;
    this.lastUpdate = at;
  }

  synchronized ProgressStatus status() {
    return status;
  }

  synchronized ProgressSnapshot snapshot() {
    int sent = 0;
    int failed = 0;
    for (Tally tally : ledger.values()) {
      sent += tally.sent();
      failed += tally.failed();
    }
    return new ProgressSnapshot(campaignId, sent, failed, total, status, startedAt, lastUpdate);
  }
}
