package io.echomail.backend.pause;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pause")
public class PauseController {

  private final GlobalPauseService pauseService;

  public PauseController(GlobalPauseService pauseService) {
    this.pauseService = pauseService;
  }

  @GetMapping
  public ResponseEntity<GlobalPauseResponse> getPause() {
    return ResponseEntity.ok(GlobalPauseResponse.from(pauseService.snapshot()));
  }

  /** Operator override: lifts an active pause before it expires. */
  @DeleteMapping
  public ResponseEntity<Void> clearPause() {
    pauseService.clear();
    return ResponseEntity.noContent().build();
  }
}
