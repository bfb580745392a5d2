package io.echomail.backend.dispatch;

import java.util.Objects;

/**
 * Per-message result of a dispatch run. Only the dispatcher mutates it, and every mutation goes
 * through {@link DispatchStatus#canTransitionTo}.
 */
public class SendOutcome {

  private final String recipientAddress;
  private final int index;
  private DispatchStatus status = DispatchStatus.PENDING;
  private int retryCount;
  private String errorMessage;

  public SendOutcome(String recipientAddress, int index) {
    this.recipientAddress = Objects.requireNonNull(recipientAddress, "recipientAddress");
    this.index = index;
  }

  /** Records that attempt number {@code attempt} (1-based) is about to be made. */
  public void recordAttempt(int attempt) {
    if (status.isTerminal()) {
      throw new IllegalStateException(
          "Cannot attempt message " + index + " in terminal state " + status);
    }
    this.retryCount = attempt;
  }

  public void markRetrying(int attempt, String lastError) {
    transition(DispatchStatus.RETRYING);
    this.retryCount = attempt;
    this.errorMessage = lastError;
  }

  public void succeed() {
    transition(DispatchStatus.SUCCESS);
    this.errorMessage = null;
  }

  public void fail(String errorMessage) {
    transition(DispatchStatus.ERROR);
    this.errorMessage = errorMessage;
  }

  public void skip(String reason) {
    transition(DispatchStatus.SKIPPED);
    this.errorMessage = reason;
  }

  public void cancel(String reason) {
    transition(DispatchStatus.CANCELLED);
    this.errorMessage = reason;
  }

  private void transition(DispatchStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Illegal transition for message " + index + ": " + status + " -> " + next);
    }
    this.status = next;
  }

  public String getRecipientAddress() {
    return recipientAddress;
  }

  public int getIndex() {
    return index;
  }

  public DispatchStatus getStatus() {
    return status;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  @Override
  public String toString() {
    return "SendOutcome{index=" + index + ", to=" + recipientAddress + ", status=" + status + "}";
  }
}
