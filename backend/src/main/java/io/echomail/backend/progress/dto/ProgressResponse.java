package io.echomail.backend.progress.dto;

import io.echomail.backend.pause.GlobalPauseResponse;
import io.echomail.backend.pause.GlobalPauseState;
import io.echomail.backend.progress.ProgressSnapshot;
import java.time.Instant;

public record ProgressResponse(
    String campaignId,
    int sent,
    int failed,
    int total,
    String status,
    Instant startedAt,
    Instant lastUpdate,
    GlobalPauseResponse globalPause) {

  public static ProgressResponse from(ProgressSnapshot snapshot, GlobalPauseState pause) {
    return new ProgressResponse(
        snapshot.campaignId(),
        snapshot.sent(),
        snapshot.failed(),
        snapshot.total(),
        snapshot.status().wireName(),
        snapshot.startedAt(),
        snapshot.lastUpdate(),
        GlobalPauseResponse.from(pause));
  }
}
