package io.echomail.backend.bounce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/webhooks/bounces")
public class BounceWebhookController {

  private static final Logger log = LoggerFactory.getLogger(BounceWebhookController.class);

  private final BounceWebhookService webhookService;

  public BounceWebhookController(BounceWebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @PostMapping("/{provider}")
  public ResponseEntity<WebhookResult> handleWebhook(
      @PathVariable String provider,
      @RequestBody(required = false) String payload,
      @RequestHeader(value = "X-Twilio-Email-Event-Webhook-Signature", required = false)
          String signature,
      @RequestHeader(value = "X-Twilio-Email-Event-Webhook-Timestamp", required = false)
          String timestamp,
      @RequestHeader(value = "X-Webhook-Token", required = false) String token) {
    try {
      return ResponseEntity.ok(
          webhookService.processWebhook(provider, payload, signature, timestamp, token));
    } catch (WebhookAuthenticationException e) {
      log.warn("Bounce webhook authentication failed: {}", e.getMessage());
      return ResponseEntity.status(401).build();
    } catch (WebhookPayloadException e) {
      log.warn("Invalid bounce webhook payload: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    }
  }
}
