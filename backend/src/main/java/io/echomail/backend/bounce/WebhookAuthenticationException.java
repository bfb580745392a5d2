package io.echomail.backend.bounce;

/** Thrown when webhook signature verification fails or is not configured. */
public class WebhookAuthenticationException extends RuntimeException {

  public WebhookAuthenticationException(String message) {
    super(message);
  }

  public WebhookAuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
