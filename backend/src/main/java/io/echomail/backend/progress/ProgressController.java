package io.echomail.backend.progress;

import io.echomail.backend.exception.InvalidRequestException;
import io.echomail.backend.exception.PayloadTooLargeException;
import io.echomail.backend.pause.GlobalPauseService;
import io.echomail.backend.progress.dto.ChunkRequest;
import io.echomail.backend.progress.dto.ChunkResponse;
import io.echomail.backend.progress.dto.ProgressResponse;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

@RestController
public class ProgressController {

  private static final Logger log = LoggerFactory.getLogger(ProgressController.class);

  private final ProgressAggregator progressAggregator;
  private final GlobalPauseService pauseService;
  private final ChunkDispatchService chunkDispatchService;
  private final ObjectMapper objectMapper;
  private final long maxPayloadBytes;

  public ProgressController(
      ProgressAggregator progressAggregator,
      GlobalPauseService pauseService,
      ChunkDispatchService chunkDispatchService,
      ObjectMapper objectMapper,
      @Value("${echomail.chunk.max-payload-bytes:204800}") long maxPayloadBytes) {
    this.progressAggregator = progressAggregator;
    this.pauseService = pauseService;
    this.chunkDispatchService = chunkDispatchService;
    this.objectMapper = objectMapper;
    this.maxPayloadBytes = maxPayloadBytes;
  }

  @GetMapping("/api/progress")
  public ResponseEntity<ProgressResponse> getProgress(
      @RequestParam(required = false) String campaignId) {
    if (campaignId == null || campaignId.isBlank()) {
      throw new InvalidRequestException("Missing campaignId", "campaignId is required");
    }
    return ResponseEntity.ok(
        ProgressResponse.from(progressAggregator.snapshot(campaignId), pauseService.snapshot()));
  }

  /** Body is read raw so oversized chunks are rejected before any JSON binding. */
  @PostMapping("/api/send-chunk")
  public ResponseEntity<ChunkResponse> sendChunk(@RequestBody String body)
      throws InterruptedException {
    long size = body.getBytes(StandardCharsets.UTF_8).length;
    if (size > maxPayloadBytes) {
      log.warn("Rejecting chunk of {} bytes (limit {})", size, maxPayloadBytes);
      throw new PayloadTooLargeException(size, maxPayloadBytes);
    }
    ChunkRequest request;
    try {
      request = objectMapper.readValue(body, ChunkRequest.class);
    } catch (JacksonException e) {
      throw new InvalidRequestException("Invalid request data", "Chunk body is not valid JSON");
    }
    return ResponseEntity.ok(chunkDispatchService.sendChunk(request));
  }
}
