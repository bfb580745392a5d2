package io.echomail.backend.dispatch;

import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
public class ThreadSleeper implements Sleeper {

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    if (!duration.isNegative() && !duration.isZero()) {
      Thread.sleep(duration.toMillis());
    }
  }
}
