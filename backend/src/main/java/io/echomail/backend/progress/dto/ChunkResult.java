package io.echomail.backend.progress.dto;

import io.echomail.backend.dispatch.SendOutcome;
import java.util.Locale;

public record ChunkResult(String email, int index, String status, String error, int retryCount) {

  public static ChunkResult from(SendOutcome outcome) {
    return new ChunkResult(
        outcome.getRecipientAddress(),
        outcome.getIndex(),
        outcome.getStatus().name().toLowerCase(Locale.ROOT),
        outcome.getErrorMessage(),
        outcome.getRetryCount());
  }
}
