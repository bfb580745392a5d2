package io.echomail.backend.campaign;

import io.echomail.backend.dispatch.PersonalizedMessage;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * {@link CampaignStateStore} backed by the {@code campaign_state} table. The message list and the
 * index sets are stored as JSON documents so a campaign round-trips in a single row.
 */
@Component
public class JpaCampaignStateStore implements CampaignStateStore {

  private static final Logger log = LoggerFactory.getLogger(JpaCampaignStateStore.class);

  private static final TypeReference<List<PersonalizedMessage>> MESSAGE_LIST =
      new TypeReference<>() {};
  private static final TypeReference<List<Integer>> INDEX_LIST = new TypeReference<>() {};

  private final CampaignStateRepository repository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public JpaCampaignStateStore(
      CampaignStateRepository repository, ObjectMapper objectMapper, Clock clock) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void save(CampaignState state) {
    Instant now = clock.instant();
    CampaignStateEntity entity =
        repository
            .findById(state.getCampaignId())
            .orElseGet(
                () ->
                    new CampaignStateEntity(
                        state.getCampaignId(),
                        state.getStartedAt() != null ? state.getStartedAt() : now));
    entity.apply(
        state.getSubject(),
        objectMapper.writeValueAsString(state.getMessages()),
        objectMapper.writeValueAsString(List.copyOf(state.getSentIndices())),
        objectMapper.writeValueAsString(List.copyOf(state.getFailedIndices())),
        state.getStatus(),
        state.getLastSummary(),
        now);
    repository.save(entity);
    state.touch(now);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<CampaignState> load(String campaignId) {
    return repository.findById(campaignId).map(this::toState);
  }

  @Override
  @Transactional
  public void clear(String campaignId) {
    if (repository.existsById(campaignId)) {
      repository.deleteById(campaignId);
      log.debug("Cleared persisted state for campaign {}", campaignId);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<CampaignState> findByStatus(CampaignStatus status) {
    return repository.findByStatusOrderByStartedAtAsc(status).stream().map(this::toState).toList();
  }

  private CampaignState toState(CampaignStateEntity entity) {
    try {
      return new CampaignState(
          entity.getCampaignId(),
          entity.getSubject(),
          objectMapper.readValue(entity.getMessagesJson(), MESSAGE_LIST),
          objectMapper.readValue(entity.getSentIndicesJson(), INDEX_LIST),
          objectMapper.readValue(entity.getFailedIndicesJson(), INDEX_LIST),
          entity.getStatus(),
          entity.getStartedAt(),
          entity.getUpdatedAt(),
          entity.getLastSummary());
    } catch (JacksonException e) {
      throw new IllegalStateException(
          "Corrupt persisted state for campaign " + entity.getCampaignId(), e);
    }
  }
}
