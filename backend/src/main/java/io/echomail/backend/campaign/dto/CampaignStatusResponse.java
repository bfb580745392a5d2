package io.echomail.backend.campaign.dto;

import io.echomail.backend.campaign.CampaignState;
import io.echomail.backend.campaign.CampaignStatus;
import java.time.Instant;

public record CampaignStatusResponse(
    String campaignId,
    String subject,
    CampaignStatus status,
    int total,
    int sent,
    int failed,
    int pending,
    boolean running,
    String lastSummary,
    Instant startedAt,
    Instant updatedAt) {

  public static CampaignStatusResponse from(CampaignState state, boolean running) {
    int sent = state.getSentIndices().size();
    return new CampaignStatusResponse(
        state.getCampaignId(),
        state.getSubject(),
        state.getStatus(),
        state.totalMessages(),
        sent,
        state.getFailedIndices().size(),
        state.totalMessages() - sent,
        running,
        state.getLastSummary(),
        state.getStartedAt(),
        state.getUpdatedAt());
  }
}
