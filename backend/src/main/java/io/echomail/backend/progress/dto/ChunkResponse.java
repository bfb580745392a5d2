package io.echomail.backend.progress.dto;

import java.util.List;

public record ChunkResponse(
    List<ChunkResult> results, ChunkProgress chunkInfo, ChunkSummary summary) {

  /** Where this chunk sits in the campaign, echoed back to the client. */
  public record ChunkProgress(
      int chunkIndex, int totalChunks, int processedEmails, Integer totalEmails) {}
}
