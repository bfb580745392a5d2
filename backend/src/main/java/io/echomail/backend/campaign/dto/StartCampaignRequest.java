package io.echomail.backend.campaign.dto;

import io.echomail.backend.dispatch.PersonalizedMessage;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * @param campaignId optional client-chosen id; one is generated when absent
 * @param subject default subject for messages that carry none
 * @param messages personalized messages in send order
 */
public record StartCampaignRequest(
    String campaignId,
    @NotBlank String subject,
    @NotEmpty List<@NotNull PersonalizedMessage> messages) {}
