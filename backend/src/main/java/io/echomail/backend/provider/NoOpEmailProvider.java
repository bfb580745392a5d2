package io.echomail.backend.provider;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Logs messages instead of sending them. Registered last in priority and only when {@code
 * echomail.providers.noop.enabled=true}, for local development without provider credentials.
 */
@Component
@ConditionalOnProperty(name = "echomail.providers.noop.enabled", havingValue = "true")
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  static final int PRIORITY = 100;

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public int priority() {
    return PRIORITY;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public SendResult send(EmailMessage message) {
    log.info(
        "NoOp email: would send to {} with subject '{}' and {} attachment(s)",
        message.to(),
        message.subject(),
        message.attachments().size());
    return SendResult.accepted(providerId(), "NOOP-" + UUID.randomUUID());
  }

  @Override
  public ConnectionTestResult testConnection() {
    return new ConnectionTestResult(true, providerId(), null);
  }
}
