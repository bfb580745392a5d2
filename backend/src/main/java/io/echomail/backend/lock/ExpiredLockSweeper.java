package io.echomail.backend.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically removes dispatch locks whose owners stopped refreshing them. */
@Component
public class ExpiredLockSweeper {

  private static final Logger log = LoggerFactory.getLogger(ExpiredLockSweeper.class);

  private final DispatchLock dispatchLock;

  public ExpiredLockSweeper(DispatchLock dispatchLock) {
    this.dispatchLock = dispatchLock;
  }

  @Scheduled(fixedDelayString = "${echomail.dispatch.lock-sweep-interval:60000}")
  public void sweep() {
    int removed = dispatchLock.purgeExpired();
    if (removed > 0) {
      log.info("Removed {} expired dispatch lock(s)", removed);
    }
  }
}
