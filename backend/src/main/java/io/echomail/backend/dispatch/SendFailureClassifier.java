package io.echomail.backend.dispatch;

import io.echomail.backend.provider.SendResult;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps a failed {@link SendResult} to a {@link FailureKind} by inspecting the HTTP status first and
 * falling back to the provider's error text, since SMTP and some Gmail quota errors carry no usable
 * status code.
 */
@Component
public class SendFailureClassifier {

  private static final List<String> RATE_LIMIT_MARKERS =
      List.of("rate limit", "ratelimitexceeded", "too many requests", "quota exceeded");

  private static final List<String> SESSION_MARKERS =
      List.of(
          "session expired",
          "unauthorized",
          "invalid credentials",
          "invalid_grant",
          "authentication failed");

  private static final List<String> PAYLOAD_MARKERS =
      List.of(
          "invalid email",
          "invalid address",
          "invalid to address",
          "email too large",
          "too large",
          "invalid message");

  /** Status codes quoted in error text; only consulted when the transport reports no status. */
  private static final Pattern QUOTED_STATUS = Pattern.compile("\\b(429|401|413)\\b");

  public FailureKind classify(SendResult result) {
    if (result.success()) {
      throw new IllegalArgumentException("Cannot classify a successful send");
    }
    Integer status = result.statusCode();
    if (status != null) {
      if (status == 429) {
        return FailureKind.RATE_LIMITED;
      }
      if (status == 401) {
        return FailureKind.FATAL_SESSION;
      }
      if (status == 413) {
        return FailureKind.FATAL_PAYLOAD;
      }
    }
    return classifyMessage(result.errorMessage(), status);
  }

  FailureKind classifyMessage(String errorMessage, Integer status) {
    String text = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
    if (status == null) {
      Matcher quoted = QUOTED_STATUS.matcher(text);
      if (quoted.find()) {
        return switch (quoted.group(1)) {
          case "429" -> FailureKind.RATE_LIMITED;
          case "401" -> FailureKind.FATAL_SESSION;
          default -> FailureKind.FATAL_PAYLOAD;
        };
      }
    }
    if (containsAny(text, RATE_LIMIT_MARKERS)) {
      return FailureKind.RATE_LIMITED;
    }
    if (containsAny(text, SESSION_MARKERS)) {
      return FailureKind.FATAL_SESSION;
    }
    if (containsAny(text, PAYLOAD_MARKERS)) {
      return FailureKind.FATAL_PAYLOAD;
    }
    if (status != null && status == 400) {
      return FailureKind.FATAL_PAYLOAD;
    }
    return FailureKind.RETRYABLE_TRANSIENT;
  }

  private static boolean containsAny(String text, List<String> markers) {
    for (String marker : markers) {
      if (text.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
