package io.echomail.backend.campaign.dto;

import io.echomail.backend.campaign.CampaignStatus;
import java.util.List;

public record StartCampaignResponse(
    String campaignId, int accepted, List<String> suppressed, CampaignStatus status) {}
