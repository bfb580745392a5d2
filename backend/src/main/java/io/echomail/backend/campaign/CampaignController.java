package io.echomail.backend.campaign;

import io.echomail.backend.campaign.dto.CampaignStatusResponse;
import io.echomail.backend.campaign.dto.StartCampaignRequest;
import io.echomail.backend.campaign.dto.StartCampaignResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/campaigns")
public class CampaignController {

  static final String WORKER_ID_HEADER = "X-Worker-Id";

  private final CampaignService campaignService;

  public CampaignController(CampaignService campaignService) {
    this.campaignService = campaignService;
  }

  @PostMapping
  public ResponseEntity<StartCampaignResponse> startCampaign(
      @Valid @RequestBody StartCampaignRequest request,
      @RequestHeader(value = WORKER_ID_HEADER, required = false) String workerId) {
    StartCampaignResponse response = campaignService.start(request, resolveWorker(workerId));
    return ResponseEntity.accepted()
        .location(URI.create("/api/campaigns/" + response.campaignId()))
        .body(response);
  }

  @GetMapping("/{campaignId}")
  public ResponseEntity<CampaignStatusResponse> getCampaign(@PathVariable String campaignId) {
    return ResponseEntity.ok(campaignService.status(campaignId));
  }

  @PostMapping("/{campaignId}/resume")
  public ResponseEntity<CampaignStatusResponse> resumeCampaign(
      @PathVariable String campaignId,
      @RequestParam(defaultValue = "false") boolean waitForPause,
      @RequestHeader(value = WORKER_ID_HEADER, required = false) String workerId) {
    return ResponseEntity.accepted()
        .body(campaignService.resume(campaignId, resolveWorker(workerId), waitForPause));
  }

  @PostMapping("/{campaignId}/cancel")
  public ResponseEntity<Void> cancelCampaign(@PathVariable String campaignId) {
    campaignService.cancel(campaignId);
    return ResponseEntity.accepted().build();
  }

  @DeleteMapping("/{campaignId}")
  public ResponseEntity<Void> discardCampaign(@PathVariable String campaignId) {
    campaignService.discard(campaignId);
    return ResponseEntity.noContent().build();
  }

  private static String resolveWorker(String workerId) {
    return workerId != null && !workerId.isBlank() ? workerId : "worker-" + UUID.randomUUID();
  }
}
