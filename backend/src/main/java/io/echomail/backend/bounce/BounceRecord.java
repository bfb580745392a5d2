package io.echomail.backend.bounce;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** One classified bounce. Append-only: records are never updated after insert. */
@Entity
@Table(name = "bounce_record")
public class BounceRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "address", nullable = false, length = 320, updatable = false)
  private String address;

  @Enumerated(EnumType.STRING)
  @Column(name = "bounce_type", nullable = false, length = 20, updatable = false)
  private BounceType type;

  @Enumerated(EnumType.STRING)
  @Column(name = "category", nullable = false, length = 30, updatable = false)
  private BounceCategory category;

  @Column(name = "reason", nullable = false, columnDefinition = "TEXT", updatable = false)
  private String reason;

  @Column(name = "diagnostic_code", columnDefinition = "TEXT", updatable = false)
  private String diagnosticCode;

  @Column(name = "campaign_id", length = 100, updatable = false)
  private String campaignId;

  @Column(name = "message_id", length = 200, updatable = false)
  private String messageId;

  @Column(name = "recorded_at", nullable = false, updatable = false)
  private Instant recordedAt;

  protected BounceRecord() {}

  public BounceRecord(
      String address,
      BounceType type,
      BounceCategory category,
      String reason,
      String diagnosticCode,
      String campaignId,
      String messageId,
      Instant recordedAt) {
    this.address = address;
    this.type = type;
    this.category = category;
    this.reason = reason;
    this.diagnosticCode = diagnosticCode;
    this.campaignId = campaignId;
    this.messageId = messageId;
    this.recordedAt = recordedAt;
  }

  public UUID getId() {
    return id;
  }

  public String getAddress() {
    return address;
  }

  public BounceType getType() {
    return type;
  }

  public BounceCategory getCategory() {
    return category;
  }

  public String getReason() {
    return reason;
  }

  public String getDiagnosticCode() {
    return diagnosticCode;
  }

  public String getCampaignId() {
    return campaignId;
  }

  public String getMessageId() {
    return messageId;
  }

  public Instant getRecordedAt() {
    return recordedAt;
  }
}
