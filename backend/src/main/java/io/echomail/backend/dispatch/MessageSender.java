package io.echomail.backend.dispatch;

import io.echomail.backend.provider.EmailMessage;
import io.echomail.backend.provider.ProviderGateway;
import io.echomail.backend.provider.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends one message with bounded retries. Transient failures are retried after {@code retryDelay}
 * up to {@code maxRetries} calls in total; rate limits and fatal failures return immediately so
 * the caller can halt. The outcome is left non-terminal on failure: the caller decides how the
 * failure is recorded.
 */
@Component
public class MessageSender {

  private static final Logger log = LoggerFactory.getLogger(MessageSender.class);

  static final String CANCELLED_REASON = "Cancelled by user";

  private final ProviderGateway providerGateway;
  private final SendFailureClassifier classifier;
  private final Sleeper sleeper;
  private final DispatchProperties properties;

  public MessageSender(
      ProviderGateway providerGateway,
      SendFailureClassifier classifier,
      Sleeper sleeper,
      DispatchProperties properties) {
    this.providerGateway = providerGateway;
    this.classifier = classifier;
    this.sleeper = sleeper;
    this.properties = properties;
  }

  public DeliveryReport deliver(EmailMessage message, SendOutcome outcome, CancellationToken token)
      throws InterruptedException {
    String lastError = null;
    FailureKind lastKind = FailureKind.RETRYABLE_TRANSIENT;
    int attempt = 0;
    while (attempt < properties.maxRetries()) {
      attempt++;
      if (attempt > 1) {
        outcome.markRetrying(attempt, lastError);
        sleeper.sleep(properties.retryDelay());
      }
      if (token.isCancellationRequested()) {
        outcome.cancel(CANCELLED_REASON);
        return DeliveryReport.cancelled(attempt - 1);
      }
      outcome.recordAttempt(attempt);
      SendResult result = providerGateway.send(message);
      if (result.success()) {
        outcome.succeed();
        log.debug(
            "Delivered message {} via {} on attempt {}",
            outcome.getIndex(),
            result.provider(),
            attempt);
        return DeliveryReport.delivered(attempt);
      }
      lastError = result.errorMessage();
      lastKind = classifier.classify(result);
      log.warn(
          "Attempt {}/{} for message {} failed ({}): {}",
          attempt,
          properties.maxRetries(),
          outcome.getIndex(),
          lastKind,
          lastError);
      if (!lastKind.isRetryable()) {
        break;
      }
    }
    return DeliveryReport.failed(lastKind, lastError, attempt);
  }
}
