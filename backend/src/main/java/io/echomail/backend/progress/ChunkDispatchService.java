package io.echomail.backend.progress;

import io.echomail.backend.bounce.EligibilityResult;
import io.echomail.backend.bounce.SuppressionService;
import io.echomail.backend.dispatch.CancellationToken;
import io.echomail.backend.dispatch.DeliveryReport;
import io.echomail.backend.dispatch.DispatchProperties;
import io.echomail.backend.dispatch.DispatchStatus;
import io.echomail.backend.dispatch.DispatchSummaries;
import io.echomail.backend.dispatch.HaltReason;
import io.echomail.backend.dispatch.MessageSender;
import io.echomail.backend.dispatch.PersonalizedMessage;
import io.echomail.backend.dispatch.PlaceholderRenderer;
import io.echomail.backend.dispatch.SendOutcome;
import io.echomail.backend.dispatch.Sleeper;
import io.echomail.backend.exception.GlobalPauseActiveException;
import io.echomail.backend.exception.InvalidRequestException;
import io.echomail.backend.pause.GlobalPauseService;
import io.echomail.backend.pause.GlobalPauseState;
import io.echomail.backend.progress.dto.ChunkEmail;
import io.echomail.backend.progress.dto.ChunkRequest;
import io.echomail.backend.progress.dto.ChunkResponse;
import io.echomail.backend.progress.dto.ChunkResult;
import io.echomail.backend.progress.dto.ChunkSummary;
import io.echomail.backend.provider.EmailMessage;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends one client-submitted chunk of a campaign synchronously and records it with the {@link
 * ProgressAggregator}. Follows the same rules as a server-side run: suppressed recipients are
 * skipped, messages go out one at a time with retries, and the first undeliverable message skips
 * the rest of the chunk.
 */
@Service
public class ChunkDispatchService {

  private static final Logger log = LoggerFactory.getLogger(ChunkDispatchService.class);

  static final String SUPPRESSED_REASON = "Address is suppressed";
  static final String SKIPPED_AFTER_ERROR = "Skipped due to previous error";
  static final String SKIPPED_FOR_PAUSE = "Skipped due to rate limit pause";

  private final MessageSender messageSender;
  private final PlaceholderRenderer renderer;
  private final SuppressionService suppressionService;
  private final GlobalPauseService pauseService;
  private final ProgressAggregator progressAggregator;
  private final Sleeper sleeper;
  private final DispatchProperties properties;

  public ChunkDispatchService(
      MessageSender messageSender,
      PlaceholderRenderer renderer,
      SuppressionService suppressionService,
      GlobalPauseService pauseService,
      ProgressAggregator progressAggregator,
      Sleeper sleeper,
      DispatchProperties properties) {
    this.messageSender = messageSender;
    this.renderer = renderer;
    this.suppressionService = suppressionService;
    this.pauseService = pauseService;
    this.progressAggregator = progressAggregator;
    this.sleeper = sleeper;
    this.properties = properties;
  }

  /**
   * @throws GlobalPauseActiveException if a global pause is active when the chunk arrives
   * @throws InvalidRequestException if the chunk holds no emails
   */
  public ChunkResponse sendChunk(ChunkRequest request) throws InterruptedException {
    List<ChunkEmail> emails = request.personalizedEmails();
    if (emails == null || emails.isEmpty()) {
      throw new InvalidRequestException("No emails provided", "The chunk contains no emails");
    }
    if (pauseService.isPaused()) {
      GlobalPauseState pause = pauseService.snapshot();
      log.info("Rejecting chunk {} during global pause", request.chunkIndexOrDefault());
      throw new GlobalPauseActiveException(pause.reason(), pause.remaining());
    }

    String campaignId = request.campaignId();
    int chunkIndex = request.chunkIndexOrDefault();
    int totalChunks = request.totalChunksOrDefault();
    int startIndex = request.chunkInfo() != null ? request.chunkInfo().startIndex() : 0;
    int totalEmails =
        request.chunkInfo() != null ? request.chunkInfo().totalEmails() : emails.size();
    if (campaignId != null) {
      progressAggregator.begin(campaignId, totalEmails);
    }
    log.info(
        "Processing chunk {}/{} with {} email(s) for campaign {}",
        chunkIndex + 1,
        totalChunks,
        emails.size(),
        campaignId);

    List<SendOutcome> outcomes = new ArrayList<>();
    for (int i = 0; i < emails.size(); i++) {
      String to = emails.get(i).to();
      outcomes.add(new SendOutcome(to != null ? to : "", startIndex + i));
    }
    Set<String> suppressed = suppressedAddresses(emails);

    HaltReason halt = HaltReason.COMPLETED;
    CancellationToken token = CancellationToken.none();
    boolean sentAny = false;
    for (int i = 0; i < emails.size(); i++) {
      SendOutcome outcome = outcomes.get(i);
      PersonalizedMessage message = emails.get(i).toPersonalizedMessage();
      if (message.recipientAddress() != null && suppressed.contains(message.recipientAddress())) {
        outcome.skip(SUPPRESSED_REASON);
        continue;
      }
      if (pauseService.isPaused()) {
        halt = HaltReason.RATE_LIMITED;
        skipFrom(outcomes, i, SKIPPED_FOR_PAUSE);
        break;
      }
      if (sentAny) {
        sleeper.sleep(properties.betweenEmailsDelay());
      }
      sentAny = true;

      halt = sendOne(message, outcome, campaignId, chunkIndex, token);
      if (halt != HaltReason.COMPLETED) {
        skipFrom(
            outcomes,
            i + 1,
            halt == HaltReason.RATE_LIMITED ? SKIPPED_FOR_PAUSE : SKIPPED_AFTER_ERROR);
        break;
      }
    }

    if (campaignId != null) {
      progressAggregator.recordChunk(campaignId, chunkIndex, totalChunks, totalEmails, outcomes);
    }
    return buildResponse(outcomes, halt, chunkIndex, totalChunks, startIndex, request);
  }

  private HaltReason sendOne(
      PersonalizedMessage message,
      SendOutcome outcome,
      String campaignId,
      int chunkIndex,
      CancellationToken token)
      throws InterruptedException {
    EmailMessage email;
    try {
      email = renderer.toEmailMessage(message, campaignId);
    } catch (IllegalArgumentException e) {
      outcome.fail(e.getMessage());
      return HaltReason.STOPPED_ON_ERROR;
    }
    DeliveryReport report = messageSender.deliver(email, outcome, token);
    return switch (report.result()) {
      case DELIVERED -> HaltReason.COMPLETED;
      case CANCELLED -> HaltReason.CANCELLED;
      case RATE_LIMITED -> {
        outcome.fail("Provider rate limit reached: " + report.errorMessage());
        pauseService.triggerPause("Provider rate limit during chunk " + (chunkIndex + 1));
        yield HaltReason.RATE_LIMITED;
      }
      case FAILED -> {
        outcome.fail(report.errorMessage());
        log.warn(
            "Chunk {} stopped at message {} ({}): {}",
            chunkIndex + 1,
            outcome.getIndex(),
            report.failureKind(),
            report.errorMessage());
        yield HaltReason.STOPPED_ON_ERROR;
      }
    };
  }

  private Set<String> suppressedAddresses(List<ChunkEmail> emails) {
    List<String> addresses = new ArrayList<>();
    for (ChunkEmail email : emails) {
      if (email.to() != null) {
        addresses.add(email.to());
      }
    }
    EligibilityResult eligibility = suppressionService.filterEligible(addresses);
    return new HashSet<>(eligibility.suppressed());
  }

  private static void skipFrom(List<SendOutcome> outcomes, int from, String reason) {
    for (int i = from; i < outcomes.size(); i++) {
      SendOutcome outcome = outcomes.get(i);
      if (!outcome.getStatus().isTerminal()) {
        outcome.skip(reason);
      }
    }
  }

  private static ChunkResponse buildResponse(
      List<SendOutcome> outcomes,
      HaltReason halt,
      int chunkIndex,
      int totalChunks,
      int startIndex,
      ChunkRequest request) {
    int sent = count(outcomes, DispatchStatus.SUCCESS);
    int failed = count(outcomes, DispatchStatus.ERROR);
    int skipped = count(outcomes, DispatchStatus.SKIPPED);
    Integer totalEmails = request.chunkInfo() != null ? request.chunkInfo().totalEmails() : null;
    return new ChunkResponse(
        outcomes.stream().map(ChunkResult::from).toList(),
        new ChunkResponse.ChunkProgress(
            chunkIndex, totalChunks, startIndex + outcomes.size(), totalEmails),
        new ChunkSummary(
            sent, failed, skipped, outcomes.size(), DispatchSummaries.describe(halt, outcomes)));
  }

  private static int count(List<SendOutcome> outcomes, DispatchStatus status) {
    return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
  }
}
