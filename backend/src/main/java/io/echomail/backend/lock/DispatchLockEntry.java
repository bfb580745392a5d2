package io.echomail.backend.lock;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Row of the {@code dispatch_lock} table. Written only through native queries. */
@Entity
@Table(name = "dispatch_lock")
public class DispatchLockEntry {

  @Id
  @Column(name = "campaign_id", nullable = false, length = 100)
  private String campaignId;

  @Column(name = "owner_id", nullable = false, length = 200)
  private String ownerId;

  @Column(name = "acquired_at", nullable = false)
  private Instant acquiredAt;

  protected DispatchLockEntry() {}

  public String getCampaignId() {
    return campaignId;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public Instant getAcquiredAt() {
    return acquiredAt;
  }
}
