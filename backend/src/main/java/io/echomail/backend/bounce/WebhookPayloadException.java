package io.echomail.backend.bounce;

/** Thrown when a webhook payload is unusable (unknown provider, malformed JSON, no recipient). */
public class WebhookPayloadException extends RuntimeException {

  public WebhookPayloadException(String message) {
    super(message);
  }

  public WebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
