package io.echomail.backend.lock;

import io.echomail.backend.dispatch.DispatchProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lock shared by every backend instance through the {@code dispatch_lock} table. Acquisition is an
 * insert-if-absent followed by a conditional claim, so two instances racing for the same campaign
 * cannot both win.
 */
@Component
@ConditionalOnProperty(
    name = "echomail.dispatch.lock-store",
    havingValue = "database",
    matchIfMissing = true)
public class DatabaseDispatchLock implements DispatchLock {

  private static final Logger log = LoggerFactory.getLogger(DatabaseDispatchLock.class);

  private final DispatchLockRepository repository;
  private final Clock clock;
  private final Duration ttl;

  public DatabaseDispatchLock(
      DispatchLockRepository repository, Clock clock, DispatchProperties properties) {
    this.repository = repository;
    this.clock = clock;
    this.ttl = properties.lockTtl();
  }

  @Override
  @Transactional
  public boolean tryAcquire(String campaignId, String ownerId) {
    Instant now = clock.instant();
    if (repository.insertIfAbsent(campaignId, ownerId, now) == 1) {
      return true;
    }
    boolean claimed = repository.claim(campaignId, ownerId, now, now.minus(ttl)) == 1;
    if (!claimed) {
      log.debug("Dispatch lock for campaign {} is held by another worker", campaignId);
    }
    return claimed;
  }

  @Override
  @Transactional
  public boolean refresh(String campaignId, String ownerId) {
    return repository.touch(campaignId, ownerId, clock.instant()) == 1;
  }

  @Override
  @Transactional
  public void release(String campaignId, String ownerId) {
    repository.deleteOwned(campaignId, ownerId);
  }

  @Override
  @Transactional
  public int purgeExpired() {
    return repository.deleteExpired(clock.instant().minus(ttl));
  }
}
