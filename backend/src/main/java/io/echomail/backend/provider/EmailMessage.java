package io.echomail.backend.provider;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic email payload. Contains the recipient, subject, body (HTML and optional plain
 * text), attachments and optional metadata for tracking.
 */
public record EmailMessage(
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    String replyTo,
    List<EmailAttachment> attachments,
    Map<String, String> metadata) {

  /** Validates required fields. */
  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Builds an HTML message tagged with the campaign it belongs to. The campaign id travels to the
   * provider (SendGrid custom args) so bounce webhooks can be attributed back to the campaign.
   */
  public static EmailMessage forCampaign(
      String to,
      String subject,
      String htmlBody,
      List<EmailAttachment> attachments,
      String campaignId) {
    Map<String, String> metadata = campaignId != null ? Map.of("campaignId", campaignId) : Map.of();
    return new EmailMessage(to, subject, htmlBody, null, null, attachments, metadata);
  }

  public boolean hasAttachments() {
    return !attachments.isEmpty();
  }
}
