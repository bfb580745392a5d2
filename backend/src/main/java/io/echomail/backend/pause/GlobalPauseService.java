package io.echomail.backend.pause;

import io.echomail.backend.campaign.CampaignState;
import io.echomail.backend.campaign.CampaignStateStore;
import io.echomail.backend.campaign.CampaignStatus;
import io.echomail.backend.dispatch.CancellationToken;
import io.echomail.backend.dispatch.DispatchProperties;
import io.echomail.backend.dispatch.Sleeper;
import io.echomail.backend.progress.ProgressAggregator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Process-wide dispatch pause, triggered when a provider reports a rate limit. While active, every
 * dispatcher stops before its next send. The pause lifts on its own once its deadline passes; the
 * first query after the deadline clears it and returns the campaigns it paused to in-progress.
 *
 * <p>All state transitions happen under this object's monitor.
 */
@Service
public class GlobalPauseService {

  private static final Logger log = LoggerFactory.getLogger(GlobalPauseService.class);

  private final CampaignStateStore stateStore;
  private final ProgressAggregator progressAggregator;
  private final Sleeper sleeper;
  private final Clock clock;
  private final DispatchProperties properties;

  private String reason;
  private Instant pausedAt;
  private Instant pausedUntil;
  private final Set<String> pausedCampaignIds = new LinkedHashSet<>();

  public GlobalPauseService(
      CampaignStateStore stateStore,
      ProgressAggregator progressAggregator,
      Sleeper sleeper,
      Clock clock,
      DispatchProperties properties) {
    this.stateStore = stateStore;
    this.progressAggregator = progressAggregator;
    this.sleeper = sleeper;
    this.clock = clock;
    this.properties = properties;
  }

  public void triggerPause(String reason) {
    triggerPause(reason, properties.pauseDuration());
  }

  /**
   * Pauses all dispatch for {@code duration}. A second trigger while paused replaces the reason and
   * deadline.
   */
  public synchronized void triggerPause(String reason, Duration duration) {
    Instant now = clock.instant();
    this.reason = reason;
    this.pausedAt = now;
    this.pausedUntil = now.plus(duration);
    log.warn("Global dispatch pause triggered for {}: {}", duration, reason);

    for (CampaignState state : stateStore.findByStatus(CampaignStatus.IN_PROGRESS)) {
      state.setStatus(CampaignStatus.PAUSED, now);
      stateStore.save(state);
      pausedCampaignIds.add(state.getCampaignId());
    }
    pausedCampaignIds.addAll(progressAggregator.pauseSending());
    if (!pausedCampaignIds.isEmpty()) {
      log.info("Paused campaigns {}", pausedCampaignIds);
    }
  }

  public synchronized boolean isPaused() {
    if (pausedUntil == null) {
      return false;
    }
    if (!clock.instant().isBefore(pausedUntil)) {
      lift("expired");
      return false;
    }
    return true;
  }

  /** Time until the pause lifts, or zero when not paused. */
  public synchronized Duration remaining() {
    if (!isPaused()) {
      return Duration.ZERO;
    }
    return Duration.between(clock.instant(), pausedUntil);
  }

  public synchronized GlobalPauseState snapshot() {
    if (!isPaused()) {
      return GlobalPauseState.inactive();
    }
    return new GlobalPauseState(true, reason, pausedAt, pausedUntil, remaining());
  }

  /** Lifts the pause immediately. No-op if not paused. */
  public synchronized void clear() {
    if (pausedUntil != null) {
      lift("cleared by operator");
    }
  }

  /**
   * Blocks until the pause lifts or {@code token} is cancelled, polling every {@code
   * pausePollInterval}.
   *
   * @return true if the pause is no longer active
   */
  public boolean awaitLift(CancellationToken token) throws InterruptedException {
    while (!token.isCancellationRequested()) {
      Duration remaining = remaining();
      if (remaining.isZero()) {
        return true;
      }
      Duration poll = properties.pausePollInterval();
      sleeper.sleep(remaining.compareTo(poll) < 0 ? remaining : poll);
    }
    return !isPaused();
  }

  private void lift(String cause) {
    Instant now = clock.instant();
    log.info("Global dispatch pause lifted ({}), previous reason: {}", cause, reason);
    for (String campaignId : pausedCampaignIds) {
      stateStore
          .load(campaignId)
          .filter(state -> state.getStatus() == CampaignStatus.PAUSED)
          .ifPresent(
              state -> {
                state.setStatus(CampaignStatus.IN_PROGRESS, now);
                stateStore.save(state);
              });
    }
    progressAggregator.resumePaused(pausedCampaignIds);
    pausedCampaignIds.clear();
    reason = null;
    pausedAt = null;
    pausedUntil = null;
  }
}
