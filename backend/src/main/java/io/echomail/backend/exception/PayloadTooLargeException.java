package io.echomail.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PayloadTooLargeException extends ErrorResponseException {

  public PayloadTooLargeException(long actualBytes, long maxBytes) {
    super(HttpStatus.CONTENT_TOO_LARGE, createProblem(actualBytes, maxBytes), null);
  }

  private static ProblemDetail createProblem(long actualBytes, long maxBytes) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONTENT_TOO_LARGE);
    problem.setTitle("Payload too large");
    problem.setDetail(
        "Request of "
            + actualBytes / 1024
            + "KB exceeds the "
            + maxBytes / 1024
            + "KB limit; send smaller chunks");
    return problem;
  }
}
