package io.echomail.backend.dispatch;

/** Why a dispatch run stopped. */
public enum HaltReason {
  COMPLETED,
  STOPPED_ON_ERROR,
  RATE_LIMITED,
  CANCELLED
}
