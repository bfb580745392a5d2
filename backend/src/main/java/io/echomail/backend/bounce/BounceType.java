package io.echomail.backend.bounce;

public enum BounceType {
  HARD,
  SOFT,
  COMPLAINT,
  UNSUBSCRIBE
}
