package io.echomail.backend.provider;

import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/providers")
public class ProviderHealthController {

  private final ProviderGateway providerGateway;

  public ProviderHealthController(ProviderGateway providerGateway) {
    this.providerGateway = providerGateway;
  }

  @GetMapping("/health")
  public ResponseEntity<Map<String, ConnectionTestResult>> health() {
    return ResponseEntity.ok(providerGateway.verifyAll());
  }
}
