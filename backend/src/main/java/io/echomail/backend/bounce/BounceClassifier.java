package io.echomail.backend.bounce;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Classifies a bounce from its DSN (RFC 3463) status code, then lets an explicit provider bounce
 * type override the result. Unrecognised 5.x.x codes are hard bounces; anything else defaults to a
 * soft bounce of unknown category.
 */
@Component
public class BounceClassifier {

  private record Classification(BounceType type, BounceCategory category) {}

  private static final Pattern DSN_CODE = Pattern.compile("([45])\\.\\d+\\.\\d+");

  private static final Map<String, Classification> DSN_TABLE =
      Map.ofEntries(
          Map.entry("5.1.0", hard(BounceCategory.INVALID_ADDRESS)),
          Map.entry("5.1.1", hard(BounceCategory.INVALID_ADDRESS)),
          Map.entry("5.1.2", hard(BounceCategory.INVALID_ADDRESS)),
          Map.entry("5.1.3", hard(BounceCategory.INVALID_ADDRESS)),
          Map.entry("5.1.6", hard(BounceCategory.INVALID_ADDRESS)),
          Map.entry("4.2.1", soft(BounceCategory.MAILBOX_FULL)),
          Map.entry("4.2.2", soft(BounceCategory.MAILBOX_FULL)),
          Map.entry("4.4.1", soft(BounceCategory.SERVER_ERROR)),
          Map.entry("4.4.2", soft(BounceCategory.SERVER_ERROR)),
          Map.entry("4.7.0", soft(BounceCategory.BLOCKED)),
          Map.entry("5.7.1", hard(BounceCategory.POLICY_VIOLATION)),
          Map.entry("5.7.2", hard(BounceCategory.POLICY_VIOLATION)));

  public BounceRecord classify(BounceNotification notification, Instant recordedAt) {
    if (notification.address() == null || notification.address().isBlank()) {
      throw new IllegalArgumentException("Bounce notification has no address");
    }
    Classification result = fromDiagnostic(notification.diagnosticCode());
    result = applyBounceType(result, notification.bounceType());

    String diagnostic = notification.diagnosticCode();
    String reason =
        diagnostic != null && !diagnostic.isBlank()
            ? diagnostic
            : result.type().name().toLowerCase(Locale.ROOT) + " bounce";
    return new BounceRecord(
        normalize(notification.address()),
        result.type(),
        result.category(),
        reason,
        diagnostic,
        notification.campaignId(),
        notification.messageId(),
        recordedAt);
  }

  private Classification fromDiagnostic(String diagnosticCode) {
    Classification fallback = soft(BounceCategory.UNKNOWN);
    if (diagnosticCode == null) {
      return fallback;
    }
    Matcher matcher = DSN_CODE.matcher(diagnosticCode);
    if (!matcher.find()) {
      return fallback;
    }
    String code = matcher.group();
    Classification mapped = DSN_TABLE.get(code);
    if (mapped != null) {
      return mapped;
    }
    return code.startsWith("5") ? hard(BounceCategory.UNKNOWN) : fallback;
  }

  private Classification applyBounceType(Classification current, String bounceType) {
    if (bounceType == null) {
      return current;
    }
    String type = bounceType.toLowerCase(Locale.ROOT);
    if (type.contains("permanent") || type.contains("hard")) {
      return new Classification(BounceType.HARD, current.category());
    }
    if (type.contains("complaint") || type.contains("spamreport")) {
      return new Classification(BounceType.COMPLAINT, BounceCategory.SPAM_COMPLAINT);
    }
    if (type.contains("unsubscribe")) {
      return new Classification(BounceType.UNSUBSCRIBE, current.category());
    }
    return current;
  }

  static String normalize(String address) {
    return address.trim().toLowerCase(Locale.ROOT);
  }

  private static Classification hard(BounceCategory category) {
    return new Classification(BounceType.HARD, category);
  }

  private static Classification soft(BounceCategory category) {
    return new Classification(BounceType.SOFT, category);
  }
}
