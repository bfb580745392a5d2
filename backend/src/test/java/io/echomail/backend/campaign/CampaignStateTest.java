package io.echomail.backend.campaign;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.echomail.backend.dispatch.PersonalizedMessage;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class CampaignStateTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private static CampaignState threeMessages() {
    return new CampaignState(
        "c-1",
        "Subject",
        List.of(
            PersonalizedMessage.of("a@x.com", "S", "b"),
            PersonalizedMessage.of("b@x.com", "S", "b"),
            PersonalizedMessage.of("c@x.com", "S", "b")),
        NOW);
  }

  @Test
  void unsent_indices_include_failed_ones_in_order() {
    var state = threeMessages();
    state.markSent(0);
    state.markFailed(1);

    assertThat(state.unsentIndices()).containsExactly(1, 2);
    assertThat(state.isFullySent()).isFalse();
  }

  @Test
  void sending_a_failed_index_moves_it_out_of_failed() {
    var state = threeMessages();
    state.markFailed(1);
    state.markSent(1);

    assertThat(state.getFailedIndices()).isEmpty();
    assertThat(state.getSentIndices()).containsExactly(1);
  }

  @Test
  void sent_index_is_never_marked_failed() {
    var state = threeMessages();
    state.markSent(2);
    state.markFailed(2);

    assertThat(state.getFailedIndices()).isEmpty();
  }

  @Test
  void restored_state_drops_overlap_between_sent_and_failed() {
    var state =
        new CampaignState(
            "c-1",
            "S",
            threeMessages().getMessages(),
            List.of(0, 1),
            List.of(1, 2),
            CampaignStatus.PAUSED,
            NOW,
            NOW,
            "Stopped: 2 sent, 1 failed, 0 skipped");

    assertThat(state.getFailedIndices()).containsExactly(2);
    assertThat(state.unsentIndices()).containsExactly(2);
  }

  @Test
  void out_of_range_index_is_rejected() {
    var state = threeMessages();

    assertThatThrownBy(() -> state.markSent(3)).isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> state.message(-1)).isInstanceOf(IndexOutOfBoundsException.class);
  }
}
