package io.echomail.backend.provider;

/**
 * Outcome of a single provider send call.
 *
 * @param success whether the provider accepted the message
 * @param providerMessageId the provider's id for the accepted message (null on failure)
 * @param errorMessage provider error text (null on success)
 * @param provider id of the provider that produced this result
 * @param statusCode HTTP status returned by the provider, or null when the transport has none
 */
public record SendResult(
    boolean success,
    String providerMessageId,
    String errorMessage,
    String provider,
    Integer statusCode) {

  public static SendResult accepted(String provider, String providerMessageId) {
    return new SendResult(true, providerMessageId, null, provider, null);
  }

  public static SendResult failed(String provider, Integer statusCode, String errorMessage) {
    return new SendResult(false, null, errorMessage, provider, statusCode);
  }
}
