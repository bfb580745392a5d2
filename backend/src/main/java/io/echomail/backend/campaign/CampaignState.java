package io.echomail.backend.campaign;

import io.echomail.backend.dispatch.PersonalizedMessage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Resumable state of one campaign: its message list plus the indices already sent or failed. An
 * index is never in both sets. Mutated only by the thread that holds the campaign's dispatch lock.
 */
public class CampaignState {

  private final String campaignId;
  private final String subject;
  private final List<PersonalizedMessage> messages;
  private final TreeSet<Integer> sentIndices = new TreeSet<>();
  private final TreeSet<Integer> failedIndices = new TreeSet<>();
  private CampaignStatus status;
  private final Instant startedAt;
  private Instant updatedAt;
  private String lastSummary;

  public CampaignState(
      String campaignId, String subject, List<PersonalizedMessage> messages, Instant startedAt) {
    this(
        campaignId,
        subject,
        messages,
        List.of(),
        List.of(),
        CampaignStatus.IN_PROGRESS,
        startedAt,
        startedAt,
        null);
  }

  public CampaignState(
      String campaignId,
      String subject,
      List<PersonalizedMessage> messages,
      Collection<Integer> sentIndices,
      Collection<Integer> failedIndices,
      CampaignStatus status,
      Instant startedAt,
      Instant updatedAt,
      String lastSummary) {
    this.campaignId = Objects.requireNonNull(campaignId, "campaignId");
    this.subject = subject;
    this.messages = List.copyOf(messages);
    this.status = Objects.requireNonNull(status, "status");
    this.startedAt = startedAt;
    this.updatedAt = updatedAt;
    this.lastSummary = lastSummary;
    for (Integer index : sentIndices) {
      checkIndex(index);
      this.sentIndices.add(index);
    }
    for (Integer index : failedIndices) {
      checkIndex(index);
      if (!this.sentIndices.contains(index)) {
        this.failedIndices.add(index);
      }
    }
  }

  /** Indices not yet sent, ascending. Failed indices are included so a resume retries them. */
  public List<Integer> unsentIndices() {
    List<Integer> unsent = new ArrayList<>();
    for (int i = 0; i < messages.size(); i++) {
      if (!sentIndices.contains(i)) {
        unsent.add(i);
      }
    }
    return unsent;
  }

  public void markSent(int index) {
    checkIndex(index);
    sentIndices.add(index);
    failedIndices.remove(index);
  }

  public void markFailed(int index) {
    checkIndex(index);
    if (!sentIndices.contains(index)) {
      failedIndices.add(index);
    }
  }

  public boolean isFullySent() {
    return sentIndices.size() == messages.size();
  }

  public PersonalizedMessage message(int index) {
    checkIndex(index);
    return messages.get(index);
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= messages.size()) {
      throw new IndexOutOfBoundsException(
          "Message index " + index + " out of range for campaign " + campaignId);
    }
  }

  public void setStatus(CampaignStatus status, Instant at) {
    this.status = Objects.requireNonNull(status, "status");
    this.updatedAt = at;
  }

  public void setLastSummary(String lastSummary) {
    this.lastSummary = lastSummary;
  }

  public void touch(Instant at) {
    this.updatedAt = at;
  }

  public String getCampaignId() {
    return campaignId;
  }

  public String getSubject() {
    return subject;
  }

  public List<PersonalizedMessage> getMessages() {
    return messages;
  }

  public int totalMessages() {
    return messages.size();
  }

  public SortedSet<Integer> getSentIndices() {
    return Collections.unmodifiableSortedSet(sentIndices);
  }

  public SortedSet<Integer> getFailedIndices() {
    return Collections.unmodifiableSortedSet(failedIndices);
  }

  public CampaignStatus getStatus() {
    return status;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public String getLastSummary() {
    return lastSummary;
  }
}
