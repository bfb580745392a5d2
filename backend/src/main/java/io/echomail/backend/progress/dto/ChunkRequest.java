package io.echomail.backend.progress.dto;

import java.util.List;

public record ChunkRequest(
    List<ChunkEmail> personalizedEmails,
    Integer chunkIndex,
    Integer totalChunks,
    String campaignId,
    ChunkInfo chunkInfo) {

  public int chunkIndexOrDefault() {
    return chunkIndex != null ? chunkIndex : 0;
  }

  public int totalChunksOrDefault() {
    return totalChunks != null ? totalChunks : 1;
  }
}
