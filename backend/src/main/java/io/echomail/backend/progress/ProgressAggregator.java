package io.echomail.backend.progress;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.echomail.backend.dispatch.DispatchStatus;
import io.echomail.backend.dispatch.SendOutcome;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Live per-campaign progress, fed by both the server-side coordinator (one submission per message)
 * and the chunk endpoint (one submission per chunk). Entries expire 24 hours after their last
 * update.
 */
@Service
public class ProgressAggregator {

  static final Duration RETENTION = Duration.ofHours(24);

  private final Cache<String, CampaignProgress> campaigns;
  private final Clock clock;

  @Autowired
  public ProgressAggregator(Clock clock) {
    this(clock, Ticker.systemTicker());
  }

  ProgressAggregator(Clock clock, Ticker ticker) {
    this.clock = clock;
    this.campaigns =
        Caffeine.newBuilder()
            .expireAfterWrite(RETENTION)
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
  }

  /** Starts or re-opens tracking for a campaign and marks it as sending. */
  public void begin(String campaignId, int total) {
    update(
        campaignId,
        total,
        progress -> {
          progress.expandTotal(total);
          progress.setStatus(ProgressStatus.SENDING, clock.instant());
        });
  }

  /** Records the latest outcome for one message of a server-side dispatch. */
  public void recordMessage(String campaignId, int messageIndex, DispatchStatus status) {
    int sent = status == DispatchStatus.SUCCESS ? 1 : 0;
    int failed = status == DispatchStatus.ERROR ? 1 : 0;
    update(
        campaignId,
        0,
        progress -> progress.record("message:" + messageIndex, sent, failed, clock.instant()));
  }

  /**
   * Records the outcomes of one chunk. Resubmitting a chunk index replaces its earlier tally. The
   * final chunk marks the campaign completed unless it was paused meanwhile.
   */
  public void recordChunk(
      String campaignId,
      int chunkIndex,
      int totalChunks,
      int totalEmails,
      Collection<SendOutcome> outcomes) {
    int sent = count(outcomes, DispatchStatus.SUCCESS);
    int failed = count(outcomes, DispatchStatus.ERROR);
    boolean lastChunk = chunkIndex + 1 >= totalChunks;
    update(
        campaignId,
        totalEmails,
        progress -> {
          progress.expandTotal(totalEmails);
          progress.record("chunk:" + chunkIndex, sent, failed, clock.instant());
          if (lastChunk && progress.status() == ProgressStatus.SENDING) {
            progress.setStatus(ProgressStatus.COMPLETED, clock.instant());
          }
        });
  }

  public void markStatus(String campaignId, ProgressStatus status) {
    update(campaignId, 0, progress -> progress.setStatus(status, clock.instant()));
  }

  /** Moves every campaign currently sending to paused and returns their ids. */
  public List<String> pauseSending() {
    List<String> paused = new ArrayList<>();
    campaigns
        .asMap()
        .forEach(
            (id, progress) -> {
              if (progress.status() == ProgressStatus.SENDING) {
                progress.setStatus(ProgressStatus.PAUSED, clock.instant());
                paused.add(id);
              }
            });
    return paused;
  }

  /** Moves the given campaigns from paused back to sending. Others are left alone. */
  public void resumePaused(Collection<String> campaignIds) {
    for (String id : campaignIds) {
      CampaignProgress progress = campaigns.getIfPresent(id);
      if (progress != null && progress.status() == ProgressStatus.PAUSED) {
        update(id, 0, p -> p.setStatus(ProgressStatus.SENDING, clock.instant()));
      }
    }
  }

  public Optional<ProgressSnapshot> find(String campaignId) {
    return Optional.ofNullable(campaigns.getIfPresent(campaignId)).map(CampaignProgress::snapshot);
  }

  /** Snapshot for the campaign, or zero counts with status {@code unknown} if not tracked. */
  public ProgressSnapshot snapshot(String campaignId) {
    return find(campaignId).orElseGet(() -> ProgressSnapshot.unknown(campaignId));
  }

  private void update(
      String campaignId, int initialTotal, Consumer<CampaignProgress> change) {
    // compute() re-writes the entry so the retention window restarts on every update
    campaigns
        .asMap()
        .compute(
            campaignId,
            (id, current) -> {
              CampaignProgress progress =
                  current != null
                      ? current
                      : new CampaignProgress(id, initialTotal, clock.instant());
              change.accept(progress);
              return progress;
            });
  }

  private static int count(Collection<SendOutcome> outcomes, DispatchStatus status) {
    return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
  }
}
