package io.echomail.backend.lock;

/**
 * Per-campaign mutual exclusion across request threads and service instances. A lock expires if
 * its owner stops refreshing it for longer than the configured TTL, so a crashed worker never
 * blocks a campaign for good.
 */
public interface DispatchLock {

  /**
   * Acquires the lock for {@code campaignId}. Succeeds if the lock is free, expired, or already
   * held by {@code ownerId}.
   */
  boolean tryAcquire(String campaignId, String ownerId);

  /** Extends the lease. Returns false if {@code ownerId} no longer holds the lock. */
  boolean refresh(String campaignId, String ownerId);

  /** Releases the lock if held by {@code ownerId}; otherwise a no-op. */
  void release(String campaignId, String ownerId);

  /** Removes expired locks and returns how many were removed. */
  int purgeExpired();
}
