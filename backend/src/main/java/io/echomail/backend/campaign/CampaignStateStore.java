package io.echomail.backend.campaign;

import java.util.List;
import java.util.Optional;

/** Durable storage for {@link CampaignState}, keyed by campaign id. Last write wins. */
public interface CampaignStateStore {

  void save(CampaignState state);

  Optional<CampaignState> load(String campaignId);

  void clear(String campaignId);

  List<CampaignState> findByStatus(CampaignStatus status);
}
