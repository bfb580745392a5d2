package io.echomail.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class CampaignNotFoundException extends ErrorResponseException {

  public CampaignNotFoundException(String campaignId) {
    super(HttpStatus.NOT_FOUND, createProblem(campaignId), null);
  }

  private static ProblemDetail createProblem(String campaignId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Campaign not found");
    problem.setDetail("No campaign found with id " + campaignId);
    return problem;
  }
}
