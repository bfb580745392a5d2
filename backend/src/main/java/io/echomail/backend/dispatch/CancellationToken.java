package io.echomail.backend.dispatch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the thread running a dispatch and whoever asked for
 * it to stop. The dispatcher checks it before every attempt and every delay.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancellationRequested() {
    return cancelled.get();
  }
}
