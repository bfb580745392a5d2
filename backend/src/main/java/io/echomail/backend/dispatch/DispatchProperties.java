package io.echomail.backend.dispatch;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tuning knobs for campaign dispatch, bound from {@code echomail.dispatch.*}.
 *
 * @param maxRetries provider calls per message, first try included
 * @param retryDelay pause between attempts of the same message
 * @param betweenEmailsDelay pacing delay between consecutive messages
 * @param pauseDuration how long a provider rate limit pauses all dispatch
 * @param pausePollInterval how often a waiting resume re-checks the pause
 * @param lockTtl how long a dispatch lock survives without a refresh
 * @param workerThreads size of the background dispatch pool
 */
@ConfigurationProperties(prefix = "echomail.dispatch")
public record DispatchProperties(
    @DefaultValue("3") int maxRetries,
    @DefaultValue("2s") Duration retryDelay,
    @DefaultValue("1s") Duration betweenEmailsDelay,
    @DefaultValue("5m") Duration pauseDuration,
    @DefaultValue("5s") Duration pausePollInterval,
    @DefaultValue("5m") Duration lockTtl,
    @DefaultValue("4") int workerThreads) {

  public DispatchProperties {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1");
    }
  }

  public static DispatchProperties defaults() {
    return new DispatchProperties(
        3,
        Duration.ofSeconds(2),
        Duration.ofSeconds(1),
        Duration.ofMinutes(5),
        Duration.ofSeconds(5),
        Duration.ofMinutes(5),
        4);
  }
}
