package io.echomail.backend.provider;

/**
 * Port for sending emails via an external provider. Implementations build the provider-specific
 * request (OAuth API call, API-key REST call, SMTP session) but all conform to the same
 * message/result shape so the {@link ProviderGateway} can fall back between them.
 */
public interface EmailProvider {

  /** Provider identifier (e.g., "gmail", "sendgrid", "smtp", "noop"). */
  String providerId();

  /** Lower values are tried first by the gateway. */
  int priority();

  /** Whether the provider has the credentials/configuration it needs to send. */
  boolean isAvailable();

  /**
   * Send an email message. Never throws for provider-side failures; those are reported through a
   * failed {@link SendResult} carrying the HTTP status (when there is one) and the error text.
   */
  SendResult send(EmailMessage message);

  /** Test connectivity with the configured credentials. */
  ConnectionTestResult testConnection();
}
