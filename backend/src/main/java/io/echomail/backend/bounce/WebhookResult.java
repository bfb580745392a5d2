package io.echomail.backend.bounce;

import java.util.List;

/** What a bounce webhook delivery changed: one health verdict per bounce recorded. */
public record WebhookResult(String provider, int processed, List<EmailHealthStatus> addresses) {

  public WebhookResult {
    addresses = List.copyOf(addresses);
  }
}
