package io.echomail.backend.dispatch;

import java.time.Duration;

/** Blocking delay used between sends and retries. Replaced by a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;
}
