package io.echomail.backend.campaign;

import io.echomail.backend.bounce.EligibilityResult;
import io.echomail.backend.bounce.SuppressionService;
import io.echomail.backend.campaign.dto.CampaignStatusResponse;
import io.echomail.backend.campaign.dto.StartCampaignRequest;
import io.echomail.backend.campaign.dto.StartCampaignResponse;
import io.echomail.backend.dispatch.CancellationToken;
import io.echomail.backend.dispatch.DispatchCoordinator;
import io.echomail.backend.dispatch.DispatchResult;
import io.echomail.backend.dispatch.PersonalizedMessage;
import io.echomail.backend.exception.CampaignLockedException;
import io.echomail.backend.exception.CampaignNotFoundException;
import io.echomail.backend.exception.CampaignStateConflictException;
import io.echomail.backend.exception.GlobalPauseActiveException;
import io.echomail.backend.exception.InvalidRequestException;
import io.echomail.backend.lock.DispatchLock;
import io.echomail.backend.pause.GlobalPauseService;
import io.echomail.backend.pause.GlobalPauseState;
import io.echomail.backend.progress.ProgressAggregator;
import io.echomail.backend.progress.ProgressStatus;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for server-side campaigns: filters suppressed recipients, persists the initial state
 * and runs the dispatch loop in the background. The caller's worker id owns the campaign's dispatch
 * lock from the moment the request is accepted until the background run ends.
 */
@Service
public class CampaignService {

  private static final Logger log = LoggerFactory.getLogger(CampaignService.class);

  private final CampaignStateStore stateStore;
  private final SuppressionService suppressionService;
  private final DispatchCoordinator coordinator;
  private final DispatchLock dispatchLock;
  private final GlobalPauseService pauseService;
  private final ProgressAggregator progressAggregator;
  private final CampaignRunRegistry runRegistry;
  private final ExecutorService dispatchExecutor;
  private final Clock clock;

  public CampaignService(
      CampaignStateStore stateStore,
      SuppressionService suppressionService,
      DispatchCoordinator coordinator,
      DispatchLock dispatchLock,
      GlobalPauseService pauseService,
      ProgressAggregator progressAggregator,
      CampaignRunRegistry runRegistry,
      @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor,
      Clock clock) {
    this.stateStore = stateStore;
    this.suppressionService = suppressionService;
    this.coordinator = coordinator;
    this.dispatchLock = dispatchLock;
    this.pauseService = pauseService;
    this.progressAggregator = progressAggregator;
    this.runRegistry = runRegistry;
    this.dispatchExecutor = dispatchExecutor;
    this.clock = clock;
  }

  public StartCampaignResponse start(StartCampaignRequest request, String ownerId) {
    String campaignId =
        request.campaignId() != null && !request.campaignId().isBlank()
            ? request.campaignId().trim()
            : UUID.randomUUID().toString();
    if (runRegistry.isRunning(campaignId) || stateStore.load(campaignId).isPresent()) {
      throw new CampaignStateConflictException(
          "Campaign already exists",
          "Campaign " + campaignId + " already has saved progress; resume or discard it");
    }

    requireRecipients(request.messages());
    List<String> addresses =
        request.messages().stream().map(PersonalizedMessage::recipientAddress).toList();
    EligibilityResult eligibility = suppressionService.filterEligible(addresses);
    Set<String> suppressed = new HashSet<>(eligibility.suppressed());
    List<PersonalizedMessage> messages = new ArrayList<>();
    for (PersonalizedMessage message : request.messages()) {
      if (!suppressed.contains(message.recipientAddress())) {
        messages.add(withDefaultSubject(message, request.subject()));
      }
    }
    if (messages.isEmpty()) {
      throw new InvalidRequestException(
          "No eligible recipients", "Every recipient of the campaign is suppressed");
    }

    CampaignState state =
        new CampaignState(campaignId, request.subject(), messages, clock.instant());
    runRegistry.forget(campaignId);
    launch(state, ownerId, false, () -> stateStore.save(state));
    log.info(
        "Started campaign {} with {} recipient(s), {} suppressed",
        campaignId,
        messages.size(),
        eligibility.suppressed().size());
    return new StartCampaignResponse(
        campaignId, messages.size(), eligibility.suppressed(), CampaignStatus.IN_PROGRESS);
  }

  /**
   * Continues a paused campaign from its first unsent message. With {@code waitForPause} the run
   * waits in the background for an active global pause to lift; without it an active pause is
   * rejected.
   */
  public CampaignStatusResponse resume(String campaignId, String ownerId, boolean waitForPause) {
    CampaignState state =
        stateStore.load(campaignId).orElseThrow(() -> new CampaignNotFoundException(campaignId));
    if (!waitForPause && pauseService.isPaused()) {
      GlobalPauseState pause = pauseService.snapshot();
      throw new GlobalPauseActiveException(pause.reason(), pause.remaining());
    }
    launch(state, ownerId, waitForPause, () -> {});
    log.info("Resuming campaign {}: {} message(s) left", campaignId, state.unsentIndices().size());
    return CampaignStatusResponse.from(state, true);
  }

  /** Requests cooperative cancellation of a run on this instance. */
  public void cancel(String campaignId) {
    if (runRegistry.cancel(campaignId)) {
      log.info("Cancellation requested for campaign {}", campaignId);
      return;
    }
    if (stateStore.load(campaignId).isEmpty()) {
      throw new CampaignNotFoundException(campaignId);
    }
    throw new CampaignStateConflictException(
        "Campaign not running", "Campaign " + campaignId + " is not being sent by this instance");
  }

  /** Drops the saved progress of a campaign that is not running. */
  public void discard(String campaignId) {
    if (runRegistry.isRunning(campaignId)) {
      throw new CampaignStateConflictException(
          "Campaign running", "Cancel campaign " + campaignId + " before discarding it");
    }
    if (stateStore.load(campaignId).isEmpty()) {
      throw new CampaignNotFoundException(campaignId);
    }
    stateStore.clear(campaignId);
    progressAggregator.markStatus(campaignId, ProgressStatus.CANCELLED);
    log.info("Discarded saved progress of campaign {}", campaignId);
  }

  public CampaignStatusResponse status(String campaignId) {
    boolean running = runRegistry.isRunning(campaignId);
    return stateStore
        .load(campaignId)
        .map(state -> CampaignStatusResponse.from(state, running))
        .or(() -> runRegistry.finishedStatus(campaignId))
        .orElseThrow(() -> new CampaignNotFoundException(campaignId));
  }

  private void launch(
      CampaignState state, String ownerId, boolean waitForPause, Runnable beforeSubmit) {
    String campaignId = state.getCampaignId();
    CancellationToken token = new CancellationToken();
    if (!runRegistry.register(campaignId, token)) {
      throw new CampaignLockedException(
          campaignId, "Campaign " + campaignId + " is already being sent by this instance");
    }
    if (!dispatchLock.tryAcquire(campaignId, ownerId)) {
      runRegistry.finish(campaignId, null);
      throw new CampaignLockedException(campaignId);
    }
    try {
      beforeSubmit.run();
      dispatchExecutor.execute(() -> run(state, ownerId, token, waitForPause));
    } catch (RejectedExecutionException e) {
      runRegistry.finish(campaignId, null);
      dispatchLock.release(campaignId, ownerId);
      throw new CampaignStateConflictException(
          "Dispatcher unavailable", "The dispatch executor is shutting down");
    } catch (RuntimeException e) {
      runRegistry.finish(campaignId, null);
      dispatchLock.release(campaignId, ownerId);
      throw e;
    }
  }

  private void run(
      CampaignState state, String ownerId, CancellationToken token, boolean waitForPause) {
    String campaignId = state.getCampaignId();
    CampaignStatusResponse finalStatus = null;
    try {
      if (waitForPause && !pauseService.awaitLift(token)) {
        log.info("Campaign {} cancelled while waiting for the global pause", campaignId);
        return;
      }
      DispatchResult result = coordinator.dispatch(state, ownerId, token);
      if (result.status() == CampaignStatus.COMPLETED) {
        finalStatus = CampaignStatusResponse.from(state, false);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Campaign {} interrupted while waiting for the global pause", campaignId);
    } catch (RuntimeException e) {
      log.error("Dispatch of campaign {} failed", campaignId, e);
    } finally {
      runRegistry.finish(campaignId, finalStatus);
      dispatchLock.release(campaignId, ownerId);
    }
  }

  private static void requireRecipients(List<PersonalizedMessage> messages) {
    for (int i = 0; i < messages.size(); i++) {
      PersonalizedMessage message = messages.get(i);
      if (message == null
          || message.recipientAddress() == null
          || message.recipientAddress().isBlank()) {
        throw new InvalidRequestException(
            "Invalid recipient", "Message " + i + " has no recipient address");
      }
    }
  }

  private static PersonalizedMessage withDefaultSubject(
      PersonalizedMessage message, String subject) {
    if (message.subject() != null && !message.subject().isBlank()) {
      return message;
    }
    return new PersonalizedMessage(
        message.recipientAddress(),
        subject,
        message.bodyHtml(),
        message.attachments(),
        message.templateFields());
  }
}
