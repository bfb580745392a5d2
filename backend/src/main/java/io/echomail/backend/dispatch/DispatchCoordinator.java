package io.echomail.backend.dispatch;

import io.echomail.backend.campaign.CampaignState;
import io.echomail.backend.campaign.CampaignStateStore;
import io.echomail.backend.campaign.CampaignStatus;
import io.echomail.backend.exception.CampaignLockedException;
import io.echomail.backend.lock.DispatchLock;
import io.echomail.backend.pause.GlobalPauseService;
import io.echomail.backend.progress.ProgressAggregator;
import io.echomail.backend.progress.ProgressStatus;
import io.echomail.backend.provider.EmailMessage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends a campaign's unsent messages one at a time, in index order, while holding the campaign's
 * dispatch lock. The run is fail-fast: the first message that cannot be delivered stops the run and
 * every later message is skipped, so a resume picks up exactly where sending stopped. State is
 * persisted after every message.
 */
@Service
public class DispatchCoordinator {

  private static final Logger log = LoggerFactory.getLogger(DispatchCoordinator.class);

  static final String SKIPPED_AFTER_ERROR = "Skipped due to previous error";
  static final String SKIPPED_FOR_PAUSE = "Skipped due to rate limit pause";

  private final DispatchLock dispatchLock;
  private final CampaignStateStore stateStore;
  private final GlobalPauseService pauseService;
  private final ProgressAggregator progressAggregator;
  private final MessageSender messageSender;
  private final PlaceholderRenderer renderer;
  private final Sleeper sleeper;
  private final DispatchProperties properties;
  private final Clock clock;

  public DispatchCoordinator(
      DispatchLock dispatchLock,
      CampaignStateStore stateStore,
      GlobalPauseService pauseService,
      ProgressAggregator progressAggregator,
      MessageSender messageSender,
      PlaceholderRenderer renderer,
      Sleeper sleeper,
      DispatchProperties properties,
      Clock clock) {
    this.dispatchLock = dispatchLock;
    this.stateStore = stateStore;
    this.pauseService = pauseService;
    this.progressAggregator = progressAggregator;
    this.messageSender = messageSender;
    this.renderer = renderer;
    this.sleeper = sleeper;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Dispatches every message of {@code state} not yet sent.
   *
   * @throws CampaignLockedException if another owner holds the campaign's lock
   */
  public DispatchResult dispatch(CampaignState state, String ownerId, CancellationToken token) {
    String campaignId = state.getCampaignId();
    if (!dispatchLock.tryAcquire(campaignId, ownerId)) {
      throw new CampaignLockedException(campaignId);
    }
    try {
      return run(state, ownerId, token);
    } catch (CampaignLockedException e) {
      throw e;
    } catch (RuntimeException e) {
      haltOnUnexpectedError(state, e);
      throw e;
    } finally {
      dispatchLock.release(campaignId, ownerId);
    }
  }

  /** Leaves the campaign resumable after a failure the send loop does not handle itself. */
  private void haltOnUnexpectedError(CampaignState state, RuntimeException error) {
    String campaignId = state.getCampaignId();
    log.error("Dispatch of campaign {} aborted by unexpected error", campaignId, error);
    String summary =
        "Stopped (unexpected error): "
            + state.getSentIndices().size()
            + " sent, "
            + state.getFailedIndices().size()
            + " failed";
    try {
      state.setLastSummary(summary);
      state.setStatus(CampaignStatus.PAUSED, clock.instant());
      stateStore.save(state);
      progressAggregator.markStatus(campaignId, ProgressStatus.ERROR);
    } catch (RuntimeException saveFailure) {
      error.addSuppressed(saveFailure);
    }
  }

  private DispatchResult run(CampaignState state, String ownerId, CancellationToken token) {
    String campaignId = state.getCampaignId();
    List<SendOutcome> outcomes = new ArrayList<>();
    for (int index : state.unsentIndices()) {
      // a missing address becomes an "Invalid email" failure when its turn comes
      String recipient = Objects.requireNonNullElse(state.message(index).recipientAddress(), "");
      outcomes.add(new SendOutcome(recipient, index));
    }
    log.info(
        "Dispatching campaign {}: {} of {} message(s) pending",
        campaignId,
        outcomes.size(),
        state.totalMessages());

    state.setStatus(CampaignStatus.IN_PROGRESS, clock.instant());
    stateStore.save(state);
    progressAggregator.begin(campaignId, state.totalMessages());

    int position = 0;
    try {
      for (; position < outcomes.size(); position++) {
        SendOutcome outcome = outcomes.get(position);
        if (token.isCancellationRequested()) {
          cancelFrom(outcomes, position, campaignId);
          return finish(state, outcomes, HaltReason.CANCELLED);
        }
        if (pauseService.isPaused()) {
          skipFrom(outcomes, position, SKIPPED_FOR_PAUSE, campaignId);
          return finish(state, outcomes, HaltReason.RATE_LIMITED);
        }
        if (!dispatchLock.refresh(campaignId, ownerId)) {
          log.warn("Lost dispatch lock for campaign {}, reclaiming", campaignId);
          if (!dispatchLock.tryAcquire(campaignId, ownerId)) {
            throw new CampaignLockedException(campaignId);
          }
        }

        HaltReason halt = sendOne(state, outcome, token);
        progressAggregator.recordMessage(campaignId, outcome.getIndex(), outcome.getStatus());
        if (halt != null) {
          String reason =
              halt == HaltReason.RATE_LIMITED ? SKIPPED_FOR_PAUSE : SKIPPED_AFTER_ERROR;
          if (halt == HaltReason.CANCELLED) {
            cancelFrom(outcomes, position + 1, campaignId);
          } else {
            skipFrom(outcomes, position + 1, reason, campaignId);
          }
          return finish(state, outcomes, halt);
        }
        if (position < outcomes.size() - 1) {
          sleeper.sleep(properties.betweenEmailsDelay());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Dispatch of campaign {} interrupted", campaignId);
      cancelFrom(outcomes, position, campaignId);
      return finish(state, outcomes, HaltReason.CANCELLED);
    }
    return finish(state, outcomes, HaltReason.COMPLETED);
  }

  /** Sends one message and records the result. Returns the halt reason, or null to continue. */
  private HaltReason sendOne(CampaignState state, SendOutcome outcome, CancellationToken token)
      throws InterruptedException {
    int index = outcome.getIndex();
    EmailMessage message;
    try {
      message = renderer.toEmailMessage(state.message(index), state.getCampaignId());
    } catch (IllegalArgumentException e) {
      outcome.fail(e.getMessage());
      markFailed(state, index);
      return HaltReason.STOPPED_ON_ERROR;
    }

    DeliveryReport report = messageSender.deliver(message, outcome, token);
    switch (report.result()) {
      case DELIVERED -> {
        state.markSent(index);
        stateStore.save(state);
        return null;
      }
      case CANCELLED -> {
        return HaltReason.CANCELLED;
      }
      case RATE_LIMITED -> {
        outcome.fail("Provider rate limit reached: " + report.errorMessage());
        markFailed(state, index);
        pauseService.triggerPause(
            "Provider rate limit while sending campaign " + state.getCampaignId());
        return HaltReason.RATE_LIMITED;
      }
      default -> {
        outcome.fail(report.errorMessage());
        markFailed(state, index);
        log.warn(
            "Stopping campaign {} at message {} after {} attempt(s) ({}): {}",
            state.getCampaignId(),
            index,
            report.attempts(),
            report.failureKind(),
            report.errorMessage());
        return HaltReason.STOPPED_ON_ERROR;
      }
    }
  }

  private void markFailed(CampaignState state, int index) {
    state.markFailed(index);
    stateStore.save(state);
  }

  private void skipFrom(List<SendOutcome> outcomes, int from, String reason, String campaignId) {
    for (int i = from; i < outcomes.size(); i++) {
      SendOutcome outcome = outcomes.get(i);
      if (!outcome.getStatus().isTerminal()) {
        outcome.skip(reason);
        progressAggregator.recordMessage(campaignId, outcome.getIndex(), outcome.getStatus());
      }
    }
  }

  private void cancelFrom(List<SendOutcome> outcomes, int from, String campaignId) {
    for (int i = from; i < outcomes.size(); i++) {
      SendOutcome outcome = outcomes.get(i);
      if (!outcome.getStatus().isTerminal()) {
        outcome.cancel(MessageSender.CANCELLED_REASON);
        progressAggregator.recordMessage(campaignId, outcome.getIndex(), outcome.getStatus());
      }
    }
  }

  private DispatchResult finish(
      CampaignState state, List<SendOutcome> outcomes, HaltReason reason) {
    String campaignId = state.getCampaignId();
    String summary = DispatchSummaries.describe(reason, outcomes);
    state.setLastSummary(summary);
    if (state.isFullySent()) {
      state.setStatus(CampaignStatus.COMPLETED, clock.instant());
      stateStore.clear(campaignId);
      progressAggregator.markStatus(campaignId, ProgressStatus.COMPLETED);
      log.info("Campaign {} completed. {}", campaignId, summary);
      return new DispatchResult(
          campaignId, outcomes, CampaignStatus.COMPLETED, HaltReason.COMPLETED, summary);
    }

    state.setStatus(CampaignStatus.PAUSED, clock.instant());
    stateStore.save(state);
    progressAggregator.markStatus(campaignId, progressStatusFor(reason));
    log.info("Campaign {} halted ({}). {}", campaignId, reason, summary);
    return new DispatchResult(campaignId, outcomes, CampaignStatus.PAUSED, reason, summary);
  }

  private static ProgressStatus progressStatusFor(HaltReason reason) {
    return switch (reason) {
      case RATE_LIMITED -> ProgressStatus.PAUSED;
      case CANCELLED -> ProgressStatus.CANCELLED;
      case STOPPED_ON_ERROR, COMPLETED -> ProgressStatus.ERROR;
    };
  }
}
