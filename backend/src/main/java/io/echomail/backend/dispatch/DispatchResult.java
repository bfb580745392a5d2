package io.echomail.backend.dispatch;

import io.echomail.backend.campaign.CampaignStatus;
import java.util.List;

/**
 * Result of one dispatch run over a campaign's unsent messages.
 *
 * @param campaignId campaign that was dispatched
 * @param outcomes one outcome per message attempted in this run, in dispatch order
 * @param status campaign status after the run
 * @param haltReason why the run stopped
 * @param summary human-readable tally, e.g. {@code "Stopped: 1 sent, 1 failed, 2 skipped"}
 */
public record DispatchResult(
    String campaignId,
    List<SendOutcome> outcomes,
    CampaignStatus status,
    HaltReason haltReason,
    String summary) {

  public DispatchResult {
    outcomes = List.copyOf(outcomes);
  }

  public long count(DispatchStatus status) {
    return outcomes.stream().filter(o -> o.getStatus() == status).count();
  }
}
