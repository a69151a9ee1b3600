/*
 * Where: Relay service layer
 * What: Records subscriber, fanout and send metrics
 * Why: Drops and rejections are silent to callers, so they have to be observable somewhere
 */
package com.example.relay.service;

import com.example.relay.hub.PublishResult;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class RelayMetrics {

  private static final String METRIC_SUBSCRIBERS_CURRENT = "relay.subscribers.current";
  private static final String METRIC_PUBLISH_TOTAL = "relay.publish.total";
  private static final String METRIC_SUBSCRIPTION_REJECTED = "relay.subscription.rejected.total";
  private static final String METRIC_SUBSCRIPTION_CLOSED = "relay.subscription.closed.total";
  private static final String METRIC_NOTIFICATION_SENT = "relay.notification.sent.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter sentCounter;

  public RelayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.sentCounter =
        Counter.builder(METRIC_NOTIFICATION_SENT)
            .description("Notifications accepted from the sender")
            .register(meterRegistry);
  }

  public void bindSubscriberGauge(AtomicInteger connected) {
    Gauge.builder(METRIC_SUBSCRIBERS_CURRENT, connected, AtomicInteger::get)
        .description("Currently registered subscribers")
        .register(meterRegistry);
  }

  public void recordPublish(PublishResult result) {
    increment(METRIC_PUBLISH_TOTAL, "result", "delivered", result.delivered());
    increment(METRIC_PUBLISH_TOTAL, "result", "dropped", result.dropped());
    increment(METRIC_PUBLISH_TOTAL, "result", "skipped", result.skipped());
  }

  public void recordNotificationSent() {
    sentCounter.increment();
  }

  public void recordSubscriptionRejected(String reason) {
    increment(METRIC_SUBSCRIPTION_REJECTED, "reason", reason, 1);
  }

  public void recordSubscriptionClosed(String reason) {
    increment(METRIC_SUBSCRIPTION_CLOSED, "reason", reason, 1);
  }

  private void increment(String name, String tagKey, String tagValue, int amount) {
    if (amount <= 0) {
      return;
    }
    counters
        .computeIfAbsent(
            name + ":" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description("Relay " + name.replace('.', ' '))
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment(amount);
  }
}
