package io.echomail.backend.campaign;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.echomail.backend.campaign.dto.CampaignStatusResponse;
import io.echomail.backend.dispatch.CancellationToken;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * Campaign runs executing on this instance, with their cancellation tokens, plus the final status
 * of recently finished campaigns whose persisted state has been cleared.
 */
@Component
public class CampaignRunRegistry {

  private final ConcurrentMap<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();
  private final Cache<String, CampaignStatusResponse> finished =
      Caffeine.newBuilder().expireAfterWrite(Duration.ofHours(24)).maximumSize(10_000).build();

  /** Registers a run; returns false if the campaign already runs on this instance. */
  public boolean register(String campaignId, CancellationToken token) {
    return activeRuns.putIfAbsent(campaignId, token) == null;
  }

  public boolean isRunning(String campaignId) {
    return activeRuns.containsKey(campaignId);
  }

  /** Requests cancellation of a local run; returns false if none is active. */
  public boolean cancel(String campaignId) {
    CancellationToken token = activeRuns.get(campaignId);
    if (token == null) {
      return false;
    }
    token.cancel();
    return true;
  }

  public void finish(String campaignId, CampaignStatusResponse finalStatus) {
    if (finalStatus != null) {
      finished.put(campaignId, finalStatus);
    }
    activeRuns.remove(campaignId);
  }

  public Optional<CampaignStatusResponse> finishedStatus(String campaignId) {
    return Optional.ofNullable(finished.getIfPresent(campaignId));
  }

  public void forget(String campaignId) {
    finished.invalidate(campaignId);
  }
}
