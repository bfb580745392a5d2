package io.echomail.backend.config;

import io.echomail.backend.dispatch.DispatchProperties;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
public class DispatchConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  /** Runs one campaign loop per thread; the pool size bounds concurrent campaigns per instance. */
  @Bean(destroyMethod = "shutdownNow")
  ExecutorService dispatchExecutor(DispatchProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "campaign-dispatch-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(properties.workerThreads(), threadFactory);
  }
}
