package io.echomail.backend.lock;

import io.echomail.backend.dispatch.DispatchProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Single-instance lock. Only safe when exactly one backend process dispatches campaigns. */
@Component
@ConditionalOnProperty(name = "echomail.dispatch.lock-store", havingValue = "memory")
public class InMemoryDispatchLock implements DispatchLock {

  private record Lease(String ownerId, Instant acquiredAt) {}

  private final ConcurrentMap<String, Lease> leases = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration ttl;

  public InMemoryDispatchLock(Clock clock, DispatchProperties properties) {
    this.clock = clock;
    this.ttl = properties.lockTtl();
  }

  @Override
  public boolean tryAcquire(String campaignId, String ownerId) {
    Instant now = clock.instant();
    AtomicBoolean acquired = new AtomicBoolean();
    leases.compute(
        campaignId,
        (id, current) -> {
          if (current == null || current.ownerId().equals(ownerId) || isExpired(current, now)) {
            acquired.set(true);
            return new Lease(ownerId, now);
          }
          return current;
        });
    return acquired.get();
  }

  @Override
  public boolean refresh(String campaignId, String ownerId) {
    Instant now = clock.instant();
    AtomicBoolean refreshed = new AtomicBoolean();
    leases.computeIfPresent(
        campaignId,
        (id, current) -> {
          if (current.ownerId().equals(ownerId)) {
            refreshed.set(true);
            return new Lease(ownerId, now);
          }
          return current;
        });
    return refreshed.get();
  }

  @Override
  public void release(String campaignId, String ownerId) {
    leases.computeIfPresent(
        campaignId, (id, current) -> current.ownerId().equals(ownerId) ? null : current);
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    int before = leases.size();
    leases.values().removeIf(lease -> isExpired(lease, now));
    return Math.max(0, before - leases.size());
  }

  private boolean isExpired(Lease lease, Instant now) {
    return lease.acquiredAt().plus(ttl).isBefore(now);
  }
}
