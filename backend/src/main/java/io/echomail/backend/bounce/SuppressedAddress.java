package io.echomail.backend.bounce;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "suppressed_address")
public class SuppressedAddress {

  @Id
  @Column(name = "address", nullable = false, length = 320)
  private String address;

  @Column(name = "reason", nullable = false, columnDefinition = "TEXT")
  private String reason;

  @Column(name = "suppressed_at", nullable = false, updatable = false)
  private Instant suppressedAt;

  protected SuppressedAddress() {}

  public SuppressedAddress(String address, String reason, Instant suppressedAt) {
    this.address = address;
    this.reason = reason;
    this.suppressedAt = suppressedAt;
  }

  public String getAddress() {
    return address;
  }

  public String getReason() {
    return reason;
  }

  public Instant getSuppressedAt() {
    return suppressedAt;
  }
}
