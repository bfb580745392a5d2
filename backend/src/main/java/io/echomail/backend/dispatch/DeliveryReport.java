package io.echomail.backend.dispatch;

/**
 * What happened when {@link MessageSender} tried to deliver one message.
 *
 * @param result overall result of the attempts
 * @param failureKind classification of the last failure, null unless {@code result} is FAILED or
 *     RATE_LIMITED
 * @param errorMessage last provider error text
 * @param attempts number of provider calls made
 */
public record DeliveryReport(
    Result result, FailureKind failureKind, String errorMessage, int attempts) {

  public enum Result {
    DELIVERED,
    FAILED,
    RATE_LIMITED,
    CANCELLED
  }

  static DeliveryReport delivered(int attempts) {
    return new DeliveryReport(Result.DELIVERED, null, null, attempts);
  }

  static DeliveryReport failed(FailureKind kind, String errorMessage, int attempts) {
    Result result = kind == FailureKind.RATE_LIMITED ? Result.RATE_LIMITED : Result.FAILED;
    return new DeliveryReport(result, kind, errorMessage, attempts);
  }

  static DeliveryReport cancelled(int attempts) {
    return new DeliveryReport(Result.CANCELLED, null, null, attempts);
  }
}
