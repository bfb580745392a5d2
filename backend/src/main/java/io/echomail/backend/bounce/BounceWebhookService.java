package io.echomail.backend.bounce;

import com.sendgrid.helpers.eventwebhook.EventWebhook;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.Security;
import java.security.interfaces.ECPublicKey;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns provider bounce webhooks into {@link BounceNotification}s, classifies them and feeds
 * them to the {@link SuppressionService}. SendGrid deliveries must carry a valid ECDSA signature;
 * SES and Gmail deliveries are checked against a shared token when one is configured.
 */
@Service
public class BounceWebhookService {

  private static final Logger log = LoggerFactory.getLogger(BounceWebhookService.class);

  private static final int MAX_PROVIDER_LENGTH = 32;

  static {
    // EventWebhook looks up the "BC" provider by name
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  /** SendGrid events that describe a delivery problem; opens, clicks and deliveries are ignored. */
  private static final Set<String> SENDGRID_BOUNCE_EVENTS =
      Set.of("bounce", "dropped", "spamreport", "unsubscribe", "group_unsubscribe");

  private final BounceClassifier classifier;
  private final SuppressionService suppressionService;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String sendGridVerificationKey;
  private final String sharedToken;

  public BounceWebhookService(
      BounceClassifier classifier,
      SuppressionService suppressionService,
      ObjectMapper objectMapper,
      Clock clock,
      @Value("${echomail.bounces.sendgrid.webhook-verification-key:}")
          String sendGridVerificationKey,
      @Value("${echomail.bounces.webhook-token:}") String sharedToken) {
    this.classifier = classifier;
    this.suppressionService = suppressionService;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.sendGridVerificationKey = sendGridVerificationKey;
    this.sharedToken = sharedToken;
  }

  public WebhookResult processWebhook(
      String provider, String payload, String signature, String timestamp, String token) {
    String sanitizedProvider = sanitizeProvider(provider);
    List<BounceNotification> notifications =
        switch (sanitizedProvider) {
          case "sendgrid" -> {
            verifySignature(payload, signature, timestamp);
            yield parseSendGrid(payload);
          }
          case "ses" -> {
            verifySharedToken(token);
            yield parseSes(payload);
          }
          case "gmail" -> {
            verifySharedToken(token);
            yield List.of(parseGmail(payload));
          }
          default -> {
            log.warn("Unsupported bounce webhook provider: {}", sanitizedProvider);
            throw new WebhookPayloadException("Unsupported provider");
          }
        };

    List<EmailHealthStatus> results = new ArrayList<>();
    for (BounceNotification notification : notifications) {
      if (notification.address() == null || notification.address().isBlank()) {
        log.warn("Skipping {} bounce event without a recipient", sanitizedProvider);
        continue;
      }
      BounceRecord record = classifier.classify(notification, clock.instant());
      results.add(suppressionService.recordAndEvaluate(record));
    }
    log.info("Processed {} bounce(s) from {}", results.size(), sanitizedProvider);
    return new WebhookResult(sanitizedProvider, results.size(), results);
  }

  private void verifySignature(String payload, String signature, String timestamp) {
    // Fail-closed: reject all requests when verification key is not configured
    if (sendGridVerificationKey == null || sendGridVerificationKey.isBlank()) {
      log.warn(
          "SendGrid webhook verification key not configured, rejecting request. Set"
              + " echomail.bounces.sendgrid.webhook-verification-key to accept SendGrid events.");
      throw new WebhookAuthenticationException("Webhook verification key not configured");
    }
    if (signature == null || timestamp == null) {
      log.warn("Missing webhook signature or timestamp headers");
      throw new WebhookAuthenticationException("Invalid webhook signature");
    }
    try {
      EventWebhook ew = new EventWebhook();
      ECPublicKey ecPublicKey = ew.ConvertPublicKeyToECDSA(sendGridVerificationKey);
      if (!ew.VerifySignature(ecPublicKey, payload, signature, timestamp)) {
        log.warn("Invalid SendGrid webhook signature");
        throw new WebhookAuthenticationException("Invalid webhook signature");
      }
    } catch (WebhookAuthenticationException e) {
      throw e;
    } catch (Exception e) {
      log.error("Webhook signature verification failed: {}", e.getMessage());
      throw new WebhookAuthenticationException("Invalid webhook signature", e);
    }
  }

  private void verifySharedToken(String token) {
    if (sharedToken == null || sharedToken.isBlank()) {
      return;
    }
    boolean matches =
        token != null
            && MessageDigest.isEqual(
                sharedToken.getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    if (!matches) {
      log.warn("Bounce webhook rejected: missing or wrong webhook token");
      throw new WebhookAuthenticationException("Invalid webhook token");
    }
  }

  private List<BounceNotification> parseSendGrid(String payload) {
    List<Map<String, Object>> events = readJson(payload, new TypeReference<>() {});
    List<BounceNotification> notifications = new ArrayList<>();
    for (Map<String, Object> event : events) {
      String eventType = asString(event.get("event"));
      if (eventType == null || !SENDGRID_BOUNCE_EVENTS.contains(eventType)) {
        continue;
      }
      String bounceType = eventType;
      if ("bounce".equals(eventType)) {
        // SendGrid reports soft bounces as bounce events with type "blocked"
        bounceType = "blocked".equals(asString(event.get("type"))) ? "blocked" : "hard";
      }
      String diagnostic = asString(event.get("reason"));
      if (diagnostic == null) {
        diagnostic = asString(event.get("status"));
      }
      notifications.add(
          new BounceNotification(
              asString(event.get("email")),
              bounceType,
              diagnostic,
              asString(event.get("campaignId")),
              stripFilterSuffix(asString(event.get("sg_message_id")))));
    }
    return notifications;
  }

  private List<BounceNotification> parseSes(String payload) {
    Map<String, Object> body = readJson(payload, new TypeReference<>() {});
    // SNS wraps the SES notification as a JSON string in "Message"
    if (body.get("Message") instanceof String message) {
      body = readJson(message, new TypeReference<>() {});
    }
    String messageId = null;
    if (body.get("mail") instanceof Map<?, ?> mail) {
      messageId = asString(mail.get("messageId"));
    }

    List<BounceNotification> notifications = new ArrayList<>();
    if (body.get("bounce") instanceof Map<?, ?> bounce) {
      String bounceType = asString(bounce.get("bounceType"));
      for (Object recipient : asList(bounce.get("bouncedRecipients"))) {
        if (recipient instanceof Map<?, ?> r) {
          notifications.add(
              new BounceNotification(
                  asString(r.get("emailAddress")),
                  bounceType,
                  asString(r.get("diagnosticCode")),
                  null,
                  messageId));
        }
      }
    } else if (body.get("complaint") instanceof Map<?, ?> complaint) {
      for (Object recipient : asList(complaint.get("complainedRecipients"))) {
        if (recipient instanceof Map<?, ?> r) {
          notifications.add(
              new BounceNotification(
                  asString(r.get("emailAddress")), "complaint", null, null, messageId));
        }
      }
    } else {
      log.debug("SES notification carries neither bounce nor complaint, ignoring");
    }
    return notifications;
  }

  private BounceNotification parseGmail(String payload) {
    Map<String, Object> body = readJson(payload, new TypeReference<>() {});
    String address = asString(body.get("email"));
    if (address == null || address.isBlank()) {
      throw new WebhookPayloadException("Bounce payload has no email");
    }
    String diagnostic = asString(body.get("diagnostic"));
    if (diagnostic == null) {
      diagnostic = asString(body.get("status"));
    }
    return new BounceNotification(
        address,
        asString(body.get("bounceType")),
        diagnostic,
        asString(body.get("campaignId")),
        asString(body.get("messageId")));
  }

  private <T> T readJson(String payload, TypeReference<T> type) {
    if (payload == null || payload.isBlank()) {
      throw new WebhookPayloadException("Empty payload");
    }
    T value;
    try {
      value = objectMapper.readValue(payload, type);
    } catch (JacksonException e) {
      log.error("Failed to parse bounce webhook payload: {}", e.getMessage());
      throw new WebhookPayloadException("Invalid payload", e);
    }
    if (value == null) {
      // the literal JSON null
      throw new WebhookPayloadException("Invalid payload");
    }
    return value;
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static List<?> asList(Object value) {
    return value instanceof List<?> list ? list : List.of();
  }

  private static String stripFilterSuffix(String messageId) {
    if (messageId == null) {
      return null;
    }
    int filter = messageId.indexOf(".filter");
    return filter >= 0 ? messageId.substring(0, filter) : messageId;
  }

  /** Truncates and sanitizes the provider value for safe logging. */
  private static String sanitizeProvider(String provider) {
    if (provider == null) {
      return "null";
    }
    String sanitized = provider.replaceAll("[^a-zA-Z0-9_-]", "");
    return sanitized.length() > MAX_PROVIDER_LENGTH
        ? sanitized.substring(0, MAX_PROVIDER_LENGTH)
        : sanitized;
  }
}
