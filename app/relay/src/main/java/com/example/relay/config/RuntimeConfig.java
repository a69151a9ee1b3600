/*
 * Where: Relay infrastructure configuration
 * What: Clock and the thread pools that run per-subscriber duties
 * Why: Writers block on their queues, so they get a dedicated pool sized to the subscriber cap
 */
package com.example.relay.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class RuntimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "subscriberWriterExecutor")
  public ThreadPoolTaskExecutor subscriberWriterExecutor(RelayHubProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxSubscribers());
    // headroom for writers of closing connections that have not exited yet
    executor.setMaxPoolSize(properties.maxSubscribers() * 2);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("subscriber-writer-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean(name = "subscriberKeepaliveScheduler")
  public ThreadPoolTaskScheduler subscriberKeepaliveScheduler() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("subscriber-keepalive-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }
}
