package io.echomail.backend.campaign;

/**
 * Persisted lifecycle of a campaign. There is no cancelled value: a cancelled run keeps its
 * unsent messages and is stored as {@link #PAUSED} so it can be resumed or discarded.
 */
public enum CampaignStatus {
  IN_PROGRESS,
  PAUSED,
  COMPLETED
}
