package io.echomail.backend.bounce;

public enum BounceCategory {
  INVALID_ADDRESS,
  MAILBOX_FULL,
  SERVER_ERROR,
  BLOCKED,
  SPAM_COMPLAINT,
  POLICY_VIOLATION,
  UNKNOWN
}
