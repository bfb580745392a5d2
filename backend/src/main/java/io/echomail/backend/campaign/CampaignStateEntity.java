package io.echomail.backend.campaign;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "campaign_state")
public class CampaignStateEntity {

  @Id
  @Column(name = "campaign_id", nullable = false, length = 100)
  private String campaignId;

  @Column(name = "subject", columnDefinition = "TEXT")
  private String subject;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "messages", nullable = false, columnDefinition = "jsonb")
  private String messagesJson;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "sent_indices", nullable = false, columnDefinition = "jsonb")
  private String sentIndicesJson;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "failed_indices", nullable = false, columnDefinition = "jsonb")
  private String failedIndicesJson;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CampaignStatus status;

  @Column(name = "last_summary", length = 500)
  private String lastSummary;

  @Column(name = "started_at", nullable = false, updatable = false)
  private Instant startedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CampaignStateEntity() {}

  public CampaignStateEntity(String campaignId, Instant startedAt) {
    this.campaignId = campaignId;
    this.startedAt = startedAt;
  }

  @PrePersist
  void onCreate() {
    if (startedAt == null) {
      startedAt = Instant.now();
    }
    if (updatedAt == null) {
      updatedAt = startedAt;
    }
  }

  @PreUpdate
  void onUpdate() {
    if (updatedAt == null) {
      updatedAt = Instant.now();
    }
  }

  /** Overwrites every mutable column from a snapshot of the domain state. */
  public void apply(
      String subject,
      String messagesJson,
      String sentIndicesJson,
      String failedIndicesJson,
      CampaignStatus status,
      String lastSummary,
      Instant updatedAt) {
    this.subject = subject;
    this.messagesJson = messagesJson;
    this.sentIndicesJson = sentIndicesJson;
    this.failedIndicesJson = failedIndicesJson;
    this.status = status;
    this.lastSummary = lastSummary;
    this.updatedAt = updatedAt;
  }

  public String getCampaignId() {
    return campaignId;
  }

  public String getSubject() {
    return subject;
  }

  public String getMessagesJson() {
    return messagesJson;
  }

  public String getSentIndicesJson() {
    return sentIndicesJson;
  }

  public String getFailedIndicesJson() {
    return failedIndicesJson;
  }

  public CampaignStatus getStatus() {
    return status;
  }

  public String getLastSummary() {
    return lastSummary;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
