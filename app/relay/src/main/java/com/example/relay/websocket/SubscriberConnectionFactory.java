/*
 * Where: Relay subscription endpoint
 * What: Builds a SubscriberConnection wired to the hub, store and shared thread pools
 * Why: Keeps the handler free of per-connection wiring
 */
package com.example.relay.websocket;

import com.example.common.RequestIds;
import com.example.relay.config.RelayHubProperties;
import com.example.relay.hub.BroadcastHub;
import com.example.relay.hub.HistorySnapshot;
import com.example.relay.hub.PushMessageEncoder;
import com.example.relay.hub.Subscriber;
import com.example.relay.service.NotificationStore;
import com.example.relay.service.RelayMetrics;
import java.time.Clock;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
public class SubscriberConnectionFactory {

  private final BroadcastHub hub;
  private final NotificationStore store;
  private final PushMessageEncoder encoder;
  private final RelayHubProperties properties;
  private final AsyncTaskExecutor writerExecutor;
  private final TaskScheduler keepaliveScheduler;
  private final Clock clock;
  private final RelayMetrics metrics;

  public SubscriberConnectionFactory(
      BroadcastHub hub,
      NotificationStore store,
      PushMessageEncoder encoder,
      RelayHubProperties properties,
      @Qualifier("subscriberWriterExecutor") AsyncTaskExecutor writerExecutor,
      @Qualifier("subscriberKeepaliveScheduler") TaskScheduler keepaliveScheduler,
      Clock clock,
      RelayMetrics metrics) {
    this.hub = hub;
    this.store = store;
    this.encoder = encoder;
    this.properties = properties;
    this.writerExecutor = writerExecutor;
    this.keepaliveScheduler = keepaliveScheduler;
    this.clock = clock;
    this.metrics = metrics;
  }

  public SubscriberConnection create(WebSocketSession session) {
    final Subscriber subscriber =
        new Subscriber(RequestIds.newShortId(), properties.outboundQueueCapacity());
    final Supplier<HistorySnapshot> snapshotLoader =
        () -> encoder.history(store.history(properties.historySnapshotSize(), 0));
    return new SubscriberConnection(
        session,
        subscriber,
        snapshotLoader,
        hub,
        properties,
        writerExecutor,
        keepaliveScheduler,
        clock,
        metrics);
  }
}
