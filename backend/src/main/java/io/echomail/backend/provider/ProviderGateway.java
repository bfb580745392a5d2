package io.echomail.backend.provider;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes a message to the configured providers in priority order and returns the first success.
 * When every available provider fails, the last failure is returned so callers can classify it.
 */
@Component
public class ProviderGateway {

  private static final Logger log = LoggerFactory.getLogger(ProviderGateway.class);

  static final String NO_PROVIDER = "none";

  private final List<EmailProvider> providers;

  public ProviderGateway(List<EmailProvider> providers) {
    this.providers =
        providers.stream().sorted(Comparator.comparingInt(EmailProvider::priority)).toList();
    log.info(
        "Email providers registered in priority order: {}",
        this.providers.stream().map(EmailProvider::providerId).toList());
  }

  public SendResult send(EmailMessage message) {
    return sendWithFallback(message);
  }

  public SendResult sendWithFallback(EmailMessage message) {
    var available = availableProviders();
    if (available.isEmpty()) {
      log.error("No email providers available, cannot send to {}", message.to());
      return SendResult.failed(NO_PROVIDER, null, "No email providers available");
    }

    SendResult lastFailure = null;
    for (EmailProvider provider : available) {
      log.debug("Attempting to send to {} via {}", message.to(), provider.providerId());
      SendResult result;
      try {
        result = provider.send(message);
      } catch (RuntimeException e) {
        log.warn("Provider {} threw while sending to {}", provider.providerId(), message.to(), e);
        result = SendResult.failed(provider.providerId(), null, e.getMessage());
      }

      if (result.success()) {
        log.debug(
            "Email sent to {} via {} (message id {})",
            message.to(),
            provider.providerId(),
            result.providerMessageId());
        return result;
      }

      lastFailure = result;
      log.warn(
          "Provider {} failed for {}, trying next provider: {}",
          provider.providerId(),
          message.to(),
          result.errorMessage());
    }

    log.error(
        "All email providers failed for {}, last error: {}",
        message.to(),
        lastFailure.errorMessage());
    return lastFailure;
  }

  public List<EmailProvider> availableProviders() {
    return providers.stream().filter(EmailProvider::isAvailable).toList();
  }

  /** Runs a connection test against every registered provider, keyed by provider id. */
  public Map<String, ConnectionTestResult> verifyAll() {
    var results = new LinkedHashMap<String, ConnectionTestResult>();
    for (EmailProvider provider : providers) {
      if (!provider.isAvailable()) {
        results.put(
            provider.providerId(),
            new ConnectionTestResult(false, provider.providerId(), "Provider not configured"));
        continue;
      }
      results.put(provider.providerId(), provider.testConnection());
    }
    return results;
  }
}
