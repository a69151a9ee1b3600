/*
 * Where: Relay broadcast hub
 * What: Registry of live subscribers and at-most-once fanout into their queues
 * Why: One serialization point keeps per-subscriber order equal to publish order
 */
package com.example.relay.hub;

import com.example.relay.service.RelayMetrics;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BroadcastHub {

  private static final Logger logger = LoggerFactory.getLogger(BroadcastHub.class);

  // register/unregister/publish all take this lock; nothing outside iterates the set
  private final ReentrantLock lock = new ReentrantLock();
  private final Set<Subscriber> subscribers = new LinkedHashSet<>();
  private final AtomicInteger connected = new AtomicInteger();
  private final RelayMetrics metrics;

  public BroadcastHub(RelayMetrics metrics) {
    this.metrics = metrics;
    metrics.bindSubscriberGauge(connected);
  }

  /** Adds a subscriber. Admission control is the caller's job. */
  public void register(Subscriber subscriber) {
    lock.lock();
    try {
      if (subscribers.add(subscriber)) {
        connected.incrementAndGet();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Loads the history snapshot, enqueues it as the subscriber's first frame and registers the
   * subscriber, all under the hub lock. Publishes that ran before this call are contained in the
   * snapshot; publishes after it whose id is already in the snapshot are skipped for this
   * subscriber.
   *
   * <p>If {@code snapshotLoader} throws, the subscriber is not registered.
   *
   * <p>The loader runs while the lock is held, so a concurrent {@link #publish} waits for it.
   * Keep it to one bounded query: with the store pool exhausted, that wait can reach the Hikari
   * connection timeout ({@code spring.datasource.hikari.connection-timeout}, 10s).
   */
  public void register(Subscriber subscriber, Supplier<HistorySnapshot> snapshotLoader) {
    lock.lock();
    try {
      final HistorySnapshot snapshot = snapshotLoader.get();
      if (!subscriber.outbound().offer(snapshot.message())) {
        throw new IllegalStateException("outbound queue rejected history snapshot for " + subscriber);
      }
      subscriber.snapshotWatermark(snapshot.highestNotificationId());
      if (subscribers.add(subscriber)) {
        connected.incrementAndGet();
      }
    } finally {
      lock.unlock();
    }
  }

  /** Idempotent. Closes the subscriber's queue if it was registered. */
  public void unregister(Subscriber subscriber) {
    lock.lock();
    try {
      if (subscribers.remove(subscriber)) {
        connected.decrementAndGet();
        subscriber.outbound().close();
      }
    } finally {
      lock.unlock();
    }
  }

  public PublishResult publish(PushMessage message) {
    int delivered = 0;
    int dropped = 0;
    int skipped = 0;
    lock.lock();
    try {
      for (Subscriber subscriber : subscribers) {
        if (message.notificationId() > 0
            && message.notificationId() <= subscriber.snapshotWatermark()) {
          skipped++;
          continue;
        }
        if (subscriber.outbound().offer(message)) {
          delivered++;
        } else {
          dropped++;
          logger.debug(
              "outbound queue full, frame dropped subscriber={} notificationId={}",
              subscriber.id(),
              message.notificationId());
        }
      }
    } finally {
      lock.unlock();
    }
    final PublishResult result = new PublishResult(delivered, dropped, skipped);
    metrics.recordPublish(result);
    return result;
  }

  /** Point-in-time count; never waits on the registry lock. */
  public int connectedCount() {
    return connected.get();
  }
}
