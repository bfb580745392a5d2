package io.echomail.backend.exception;

import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Dispatch is globally paused after a provider rate limit. The problem body carries {@code
 * isPaused}, {@code pauseReason} and {@code pauseTimeRemaining} (milliseconds) so clients can wait
 * and retry.
 */
public class GlobalPauseActiveException extends ErrorResponseException {

  public GlobalPauseActiveException(String reason, Duration remaining) {
    super(HttpStatus.TOO_MANY_REQUESTS, createProblem(reason, remaining), null);
  }

  private static ProblemDetail createProblem(String reason, Duration remaining) {
    var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Sending paused");
    problem.setDetail(
        "Sending is paused for another "
            + Math.max(1, remaining.toSeconds())
            + "s due to provider rate limiting");
    problem.setProperty("isPaused", true);
    problem.setProperty("pauseReason", reason);
    problem.setProperty("pauseTimeRemaining", remaining.toMillis());
    return problem;
  }
}
