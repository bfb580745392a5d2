package io.echomail.backend.campaign;

import static org.assertj.core.api.Assertions.assertThat;

import io.echomail.backend.TestcontainersConfiguration;
import io.echomail.backend.dispatch.AttachmentData;
import io.echomail.backend.dispatch.PersonalizedMessage;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class JpaCampaignStateStoreIntegrationTest {

  private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private CampaignStateStore stateStore;

  private static String newCampaignId() {
    return "state-it-" + UUID.randomUUID();
  }

  private static CampaignState campaign(String campaignId) {
    var withAttachment =
        new PersonalizedMessage(
            "ada@x.com",
            "Invoice for {{name}}",
            "<p>Hi {{name}}</p>",
            List.of(new AttachmentData("invoice.pdf", "application/pdf", "JVBERi0xLjQK")),
            Map.of("name", "Ada", "plan", "Pro"));
    var plain = PersonalizedMessage.of("bob@x.com", null, "<p>Hi</p>");
    var third = PersonalizedMessage.of("cy@x.com", "Hello", "<p>Hey</p>");
    return new CampaignState(
        campaignId, "Spring sale", List.of(withAttachment, plain, third), STARTED);
  }

  @Test
  void state_round_trips_messages_attachments_and_progress() {
    String campaignId = newCampaignId();
    var state = campaign(campaignId);
    state.markSent(0);
    state.markFailed(1);
    state.setStatus(CampaignStatus.PAUSED, STARTED.plusSeconds(30));
    state.setLastSummary("Stopped: 1 sent, 1 failed, 1 skipped");

    stateStore.save(state);
    var loaded = stateStore.load(campaignId).orElseThrow();

    assertThat(loaded.getSubject()).isEqualTo("Spring sale");
    assertThat(loaded.getStatus()).isEqualTo(CampaignStatus.PAUSED);
    assertThat(loaded.getStartedAt()).isEqualTo(STARTED);
    assertThat(loaded.getLastSummary()).isEqualTo("Stopped: 1 sent, 1 failed, 1 skipped");
    assertThat(loaded.getSentIndices()).containsExactly(0);
    assertThat(loaded.getFailedIndices()).containsExactly(1);
    assertThat(loaded.unsentIndices()).containsExactly(1, 2);
    assertThat(loaded.getMessages()).isEqualTo(state.getMessages());

    var first = loaded.message(0);
    assertThat(first.templateFields()).containsEntry("name", "Ada").containsEntry("plan", "Pro");
    assertThat(first.attachments())
        .singleElement()
        .satisfies(
            attachment -> {
              assertThat(attachment.name()).isEqualTo("invoice.pdf");
              assertThat(attachment.contentType()).isEqualTo("application/pdf");
              assertThat(attachment.base64Data()).isEqualTo("JVBERi0xLjQK");
            });
    assertThat(loaded.message(1).subject()).isNull();
  }

  @Test
  void saving_again_updates_the_same_row() {
    String campaignId = newCampaignId();
    var state = campaign(campaignId);
    stateStore.save(state);

    state.markSent(0);
    state.markSent(1);
    stateStore.save(state);

    var loaded = stateStore.load(campaignId).orElseThrow();
    assertThat(loaded.getSentIndices()).containsExactly(0, 1);
    assertThat(loaded.getStartedAt()).isEqualTo(STARTED);
  }

  @Test
  void find_by_status_returns_matching_campaigns() {
    String paused = newCampaignId();
    String running = newCampaignId();
    var pausedState = campaign(paused);
    pausedState.setStatus(CampaignStatus.PAUSED, STARTED);
    stateStore.save(pausedState);
    stateStore.save(campaign(running));

    assertThat(stateStore.findByStatus(CampaignStatus.PAUSED))
        .extracting(CampaignState::getCampaignId)
        .contains(paused)
        .doesNotContain(running);
    assertThat(stateStore.findByStatus(CampaignStatus.IN_PROGRESS))
        .extracting(CampaignState::getCampaignId)
        .contains(running)
        .doesNotContain(paused);
  }

  @Test
  void clear_removes_state_and_tolerates_unknown_ids() {
    String campaignId = newCampaignId();
    stateStore.save(campaign(campaignId));

    stateStore.clear(campaignId);
    stateStore.clear(campaignId);

    assertThat(stateStore.load(campaignId)).isEmpty();
  }
}
