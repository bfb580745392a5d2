package io.echomail.backend.bounce;

/**
 * Provider-neutral bounce report extracted from a webhook payload.
 *
 * @param address the recipient that bounced
 * @param bounceType free-text type from the provider (e.g. {@code "Permanent"}, {@code
 *     "spamreport"}), may be null
 * @param diagnosticCode SMTP diagnostic such as {@code "550 5.1.1 User unknown"}, may be null
 * @param campaignId campaign the bounced message belonged to, if known
 * @param messageId provider message id, if known
 */
public record BounceNotification(
    String address, String bounceType, String diagnosticCode, String campaignId, String messageId) {

  public static BounceNotification of(String address, String bounceType, String diagnosticCode) {
    return new BounceNotification(address, bounceType, diagnosticCode, null, null);
  }
}
