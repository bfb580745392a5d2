package io.echomail.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Another worker holds the dispatch lock for the campaign. */
public class CampaignLockedException extends ErrorResponseException {

  private final String campaignId;

  public CampaignLockedException(String campaignId) {
    this(campaignId, "Campaign " + campaignId + " is already being sent by another worker");
  }

  public CampaignLockedException(String campaignId, String detail) {
    super(HttpStatus.CONFLICT, createProblem(detail), null);
    this.campaignId = campaignId;
  }

  public String getCampaignId() {
    return campaignId;
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Campaign locked");
    problem.setDetail(detail);
    return problem;
  }
}
