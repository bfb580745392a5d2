package io.echomail.backend.dispatch;

/** Classification of a failed provider send attempt. */
public enum FailureKind {

  /** Network or provider-side error; retried up to the attempt limit. */
  RETRYABLE_TRANSIENT(true),

  /** Provider throttling; triggers the global pause and halts the campaign instead of retrying. */
  RATE_LIMITED(false),

  /** Expired or invalid credentials; the campaign halts without retrying. */
  FATAL_SESSION(false),

  /** The message itself is unacceptable (too large, invalid address); not retried. */
  FATAL_PAYLOAD(false);

  private final boolean retryable;

  FailureKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
