package io.echomail.backend.bounce;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SuppressionController {

  private final SuppressionService suppressionService;

  public SuppressionController(SuppressionService suppressionService) {
    this.suppressionService = suppressionService;
  }

  @GetMapping("/api/suppressions")
  public ResponseEntity<List<SuppressionResponse>> listSuppressions() {
    return ResponseEntity.ok(
        suppressionService.listSuppressions().stream().map(SuppressionResponse::from).toList());
  }

  @PostMapping("/api/suppressions/import")
  public ResponseEntity<Map<String, Integer>> importSuppressions(
      @Valid @RequestBody ImportSuppressionsRequest request) {
    int imported = suppressionService.importSuppressions(request.addresses());
    return ResponseEntity.ok(Map.of("imported", imported));
  }

  @DeleteMapping("/api/suppressions/{address}")
  public ResponseEntity<Void> unsuppress(@PathVariable String address) {
    return suppressionService.unsuppress(address)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @GetMapping("/api/suppressions/{address}/health")
  public ResponseEntity<EmailHealthStatus> health(@PathVariable String address) {
    return ResponseEntity.ok(suppressionService.healthOf(address));
  }

  @GetMapping("/api/bounces/stats")
  public ResponseEntity<BounceStats> stats(
      @RequestParam(required = false) String campaignId,
      @RequestParam(required = false) Long totalSent) {
    BounceStats stats = suppressionService.stats(campaignId);
    if (totalSent != null && totalSent > 0) {
      stats = stats.withBounceRate(suppressionService.bounceRate(totalSent, campaignId));
    }
    return ResponseEntity.ok(stats);
  }

  public record ImportSuppressionsRequest(@NotNull List<String> addresses) {}

  public record SuppressionResponse(String address, String reason, Instant suppressedAt) {

    static SuppressionResponse from(SuppressedAddress entry) {
      return new SuppressionResponse(
          entry.getAddress(), entry.getReason(), entry.getSuppressedAt());
    }
  }
}
