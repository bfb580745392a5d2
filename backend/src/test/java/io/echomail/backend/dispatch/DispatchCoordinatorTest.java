package io.echomail.backend.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.echomail.backend.campaign.CampaignState;
import io.echomail.backend.campaign.CampaignStatus;
import io.echomail.backend.exception.CampaignLockedException;
import io.echomail.backend.lock.InMemoryDispatchLock;
import io.echomail.backend.pause.GlobalPauseService;
import io.echomail.backend.progress.ProgressAggregator;
import io.echomail.backend.progress.ProgressStatus;
import io.echomail.backend.provider.EmailMessage;
import io.echomail.backend.provider.ProviderGateway;
import io.echomail.backend.provider.SendResult;
import io.echomail.backend.testutil.InMemoryCampaignStateStore;
import io.echomail.backend.testutil.MutableClock;
import io.echomail.backend.testutil.RecordingSleeper;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DispatchCoordinatorTest {

  private static final String CAMPAIGN = "c-1";
  private static final String OWNER = "worker-1";

  private MutableClock clock;
  private InMemoryCampaignStateStore store;
  private RecordingSleeper sleeper;
  private ProgressAggregator progress;
  private GlobalPauseService pauseService;
  private InMemoryDispatchLock lock;
  private ProviderGateway gateway;
  private DispatchCoordinator coordinator;

  private final Map<String, SendResult> responses = new HashMap<>();

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    store = new InMemoryCampaignStateStore();
    sleeper = new RecordingSleeper(clock);
    var properties = DispatchProperties.defaults();
    progress = new ProgressAggregator(clock);
    pauseService = new GlobalPauseService(store, progress, sleeper, clock, properties);
    lock = new InMemoryDispatchLock(clock, properties);
    gateway = mock(ProviderGateway.class);
    when(gateway.send(any()))
        .thenAnswer(
            invocation -> {
              EmailMessage message = invocation.getArgument(0);
              return responses.getOrDefault(
                  message.to(), SendResult.accepted("gmail", "id-" + message.to()));
            });
    var sender = new MessageSender(gateway, new SendFailureClassifier(), sleeper, properties);
    coordinator =
        new DispatchCoordinator(
            lock,
            store,
            pauseService,
            progress,
            sender,
            new PlaceholderRenderer(),
            sleeper,
            properties,
            clock);
  }

  private CampaignState campaign(String... recipients) {
    List<PersonalizedMessage> messages =
        Arrays.stream(recipients)
            .map(to -> PersonalizedMessage.of(to, "Hello", "<p>Hi</p>"))
            .toList();
    return new CampaignState(CAMPAIGN, "Hello", messages, clock.instant());
  }

  private static List<DispatchStatus> statuses(DispatchResult result) {
    return result.outcomes().stream().map(SendOutcome::getStatus).toList();
  }

  private void verifySentTo(String address, int times) {
    verify(gateway, times(times)).send(argThat(m -> m.to().equals(address)));
  }

  @Test
  void sends_every_message_and_clears_state_on_completion() {
    var result =
        coordinator.dispatch(
            campaign("a@x.com", "b@x.com", "c@x.com"), OWNER, CancellationToken.none());

    assertThat(result.status()).isEqualTo(CampaignStatus.COMPLETED);
    assertThat(result.haltReason()).isEqualTo(HaltReason.COMPLETED);
    assertThat(statuses(result)).containsOnly(DispatchStatus.SUCCESS);
    assertThat(result.summary()).isEqualTo("Done: 3 sent, 0 failed");
    assertThat(store.contains(CAMPAIGN)).isFalse();
    assertThat(progress.snapshot(CAMPAIGN).status()).isEqualTo(ProgressStatus.COMPLETED);
    assertThat(progress.snapshot(CAMPAIGN).sent()).isEqualTo(3);
    assertThat(sleeper.count(Duration.ofSeconds(1))).isEqualTo(2);
  }

  @Test
  void first_undeliverable_message_stops_the_run_and_skips_the_rest() {
    responses.put("b@x.com", SendResult.failed("gmail", 400, "Invalid To address"));
    var state = campaign("a@x.com", "b@x.com", "c@x.com", "d@x.com");

    var result = coordinator.dispatch(state, OWNER, CancellationToken.none());

    assertThat(statuses(result))
        .containsExactly(
            DispatchStatus.SUCCESS,
            DispatchStatus.ERROR,
            DispatchStatus.SKIPPED,
            DispatchStatus.SKIPPED);
    assertThat(result.outcomes().get(2).getErrorMessage())
        .isEqualTo(DispatchCoordinator.SKIPPED_AFTER_ERROR);
    assertThat(result.haltReason()).isEqualTo(HaltReason.STOPPED_ON_ERROR);
    assertThat(result.status()).isEqualTo(CampaignStatus.PAUSED);
    assertThat(result.summary()).isEqualTo("Stopped: 1 sent, 1 failed, 2 skipped");
    verifySentTo("c@x.com", 0);
    verifySentTo("d@x.com", 0);

    var saved = store.load(CAMPAIGN).orElseThrow();
    assertThat(saved.getStatus()).isEqualTo(CampaignStatus.PAUSED);
    assertThat(saved.getSentIndices()).containsExactly(0);
    assertThat(saved.getFailedIndices()).containsExactly(1);
    assertThat(progress.snapshot(CAMPAIGN).status()).isEqualTo(ProgressStatus.ERROR);
  }

  @Test
  void provider_rate_limit_triggers_global_pause_and_pauses_campaign() {
    responses.put("c@x.com", SendResult.failed("gmail", 429, "rateLimitExceeded"));
    var state = campaign("a@x.com", "b@x.com", "c@x.com", "d@x.com", "e@x.com");

    var result = coordinator.dispatch(state, OWNER, CancellationToken.none());

    assertThat(statuses(result))
        .containsExactly(
            DispatchStatus.SUCCESS,
            DispatchStatus.SUCCESS,
            DispatchStatus.ERROR,
            DispatchStatus.SKIPPED,
            DispatchStatus.SKIPPED);
    assertThat(result.outcomes().get(2).getErrorMessage()).contains("rate limit");
    assertThat(result.outcomes().get(3).getErrorMessage())
        .isEqualTo(DispatchCoordinator.SKIPPED_FOR_PAUSE);
    assertThat(result.haltReason()).isEqualTo(HaltReason.RATE_LIMITED);
    assertThat(result.summary()).isEqualTo("Paused (rate limit): 2 sent, 1 failed, 2 skipped");
    assertThat(pauseService.isPaused()).isTrue();
    assertThat(pauseService.snapshot().reason()).contains(CAMPAIGN);
    assertThat(store.load(CAMPAIGN).orElseThrow().getStatus()).isEqualTo(CampaignStatus.PAUSED);
    assertThat(progress.snapshot(CAMPAIGN).status()).isEqualTo(ProgressStatus.PAUSED);
    verifySentTo("c@x.com", 1);
  }

  @Test
  void active_pause_skips_all_messages_without_sending() {
    pauseService.triggerPause("rate limit elsewhere");

    var result =
        coordinator.dispatch(campaign("a@x.com", "b@x.com"), OWNER, CancellationToken.none());

    assertThat(statuses(result)).containsOnly(DispatchStatus.SKIPPED);
    assertThat(result.haltReason()).isEqualTo(HaltReason.RATE_LIMITED);
    verify(gateway, never()).send(any());
  }

  @Test
  void transient_failures_are_bounded_then_stop_the_run() {
    responses.put("b@x.com", SendResult.failed("gmail", 503, "backend error"));

    var result =
        coordinator.dispatch(
            campaign("a@x.com", "b@x.com", "c@x.com"), OWNER, CancellationToken.none());

    verifySentTo("b@x.com", 3);
    assertThat(result.outcomes().get(1).getStatus()).isEqualTo(DispatchStatus.ERROR);
    assertThat(result.outcomes().get(1).getRetryCount()).isEqualTo(3);
    assertThat(result.outcomes().get(1).getErrorMessage()).isEqualTo("backend error");
    assertThat(result.outcomes().get(2).getStatus()).isEqualTo(DispatchStatus.SKIPPED);
    assertThat(sleeper.count(Duration.ofSeconds(2))).isEqualTo(2);
  }

  @Test
  void cancellation_marks_remaining_messages_cancelled() {
    var token = CancellationToken.none();
    sleeper.onSleep(d -> token.cancel());
    var state = campaign("a@x.com", "b@x.com", "c@x.com", "d@x.com");

    var result = coordinator.dispatch(state, OWNER, token);

    assertThat(statuses(result))
        .containsExactly(
            DispatchStatus.SUCCESS,
            DispatchStatus.CANCELLED,
            DispatchStatus.CANCELLED,
            DispatchStatus.CANCELLED);
    assertThat(result.haltReason()).isEqualTo(HaltReason.CANCELLED);
    assertThat(result.summary()).isEqualTo("Cancelled: 1 sent, 3 cancelled");
    assertThat(store.load(CAMPAIGN).orElseThrow().getSentIndices()).containsExactly(0);
    assertThat(progress.snapshot(CAMPAIGN).status()).isEqualTo(ProgressStatus.CANCELLED);
  }

  @Test
  void resume_sends_only_unsent_messages_exactly_once() {
    responses.put("b@x.com", SendResult.failed("gmail", 400, "Invalid To address"));
    var state = campaign("a@x.com", "b@x.com", "c@x.com");
    coordinator.dispatch(state, OWNER, CancellationToken.none());

    responses.clear();
    var resumed =
        coordinator.dispatch(
            store.load(CAMPAIGN).orElseThrow(), "worker-2", CancellationToken.none());

    assertThat(resumed.outcomes()).extracting(SendOutcome::getIndex).containsExactly(1, 2);
    assertThat(resumed.status()).isEqualTo(CampaignStatus.COMPLETED);
    verifySentTo("a@x.com", 1);
    verifySentTo("b@x.com", 2);
    verifySentTo("c@x.com", 1);
    assertThat(store.contains(CAMPAIGN)).isFalse();
  }

  @Test
  void blank_recipient_fails_without_calling_a_provider() {
    var result =
        coordinator.dispatch(campaign(" ", "b@x.com"), OWNER, CancellationToken.none());

    assertThat(statuses(result)).containsExactly(DispatchStatus.ERROR, DispatchStatus.SKIPPED);
    assertThat(result.outcomes().get(0).getErrorMessage()).contains("Invalid email");
    verify(gateway, never()).send(any());
  }

  @Test
  void missing_recipient_fails_in_turn_after_earlier_messages_are_sent() {
    var state = campaign("a@x.com", null, "c@x.com");

    var result = coordinator.dispatch(state, OWNER, CancellationToken.none());

    assertThat(statuses(result))
        .containsExactly(DispatchStatus.SUCCESS, DispatchStatus.ERROR, DispatchStatus.SKIPPED);
    assertThat(result.outcomes().get(1).getRecipientAddress()).isEmpty();
    assertThat(result.outcomes().get(1).getErrorMessage()).contains("Invalid email");
    assertThat(result.summary()).isEqualTo("Stopped: 1 sent, 1 failed, 1 skipped");
    verifySentTo("a@x.com", 1);
    verify(gateway, times(1)).send(any());

    var saved = store.load(CAMPAIGN).orElseThrow();
    assertThat(saved.getStatus()).isEqualTo(CampaignStatus.PAUSED);
    assertThat(saved.getSentIndices()).containsExactly(0);
  }

  @Test
  void unexpected_error_leaves_campaign_paused_with_summary() {
    doThrow(new IllegalStateException("provider client crashed"))
        .when(gateway)
        .send(argThat(m -> m.to().equals("b@x.com")));
    var state = campaign("a@x.com", "b@x.com", "c@x.com");

    assertThatThrownBy(() -> coordinator.dispatch(state, OWNER, CancellationToken.none()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("provider client crashed");

    var saved = store.load(CAMPAIGN).orElseThrow();
    assertThat(saved.getStatus()).isEqualTo(CampaignStatus.PAUSED);
    assertThat(saved.getLastSummary()).isEqualTo("Stopped (unexpected error): 1 sent, 0 failed");
    assertThat(saved.unsentIndices()).containsExactly(1, 2);
    assertThat(progress.snapshot(CAMPAIGN).status()).isEqualTo(ProgressStatus.ERROR);
    assertThat(lock.tryAcquire(CAMPAIGN, "other-worker")).isTrue();
  }

  @Test
  void lock_held_by_another_owner_rejects_dispatch() {
    assertThat(lock.tryAcquire(CAMPAIGN, "other-worker")).isTrue();

    assertThatThrownBy(
            () -> coordinator.dispatch(campaign("a@x.com"), OWNER, CancellationToken.none()))
        .isInstanceOf(CampaignLockedException.class);
    verify(gateway, never()).send(any());
  }

  @Test
  void lock_is_released_after_the_run() {
    responses.put("a@x.com", SendResult.failed("gmail", 401, "Session expired"));

    coordinator.dispatch(campaign("a@x.com"), OWNER, CancellationToken.none());

    assertThat(lock.tryAcquire(CAMPAIGN, "other-worker")).isTrue();
  }

  @Test
  void state_is_persisted_after_every_delivered_message() {
    var state = campaign("a@x.com", "b@x.com");
    // one save when the run starts, one per delivered message
    coordinator.dispatch(state, OWNER, CancellationToken.none());

    assertThat(store.saveCount()).isEqualTo(3);
  }
}
