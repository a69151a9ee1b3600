/*
 * Where: Relay subscription endpoint
 * What: Lifecycle of one subscriber socket: registration, writer, keepalive and teardown
 * Why: Every exit path has to unregister from the hub exactly once
 */
package com.example.relay.websocket;

import com.example.relay.config.RelayHubProperties;
import com.example.relay.hub.BroadcastHub;
import com.example.relay.hub.HistorySnapshot;
import com.example.relay.hub.PushMessage;
import com.example.relay.hub.Subscriber;
import com.example.relay.service.RelayMetrics;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

public class SubscriberConnection {

  private static final Logger logger = LoggerFactory.getLogger(SubscriberConnection.class);

  static final String MDC_SUBSCRIBER_ID = "subscriber_id";

  private final WebSocketSession session;
  private final Subscriber subscriber;
  private final Supplier<HistorySnapshot> snapshotLoader;
  private final BroadcastHub hub;
  private final RelayHubProperties properties;
  private final AsyncTaskExecutor writerExecutor;
  private final TaskScheduler keepaliveScheduler;
  private final Clock clock;
  private final RelayMetrics metrics;

  private final AtomicReference<ConnectionState> state =
      new AtomicReference<>(ConnectionState.CONNECTING);
  // pings come from the keepalive pool, frames from the writer; the session allows one sender
  private final Object sendLock = new Object();
  private volatile Instant readDeadline;
  private volatile Future<?> writer;
  private volatile Future<?> pinger;
  private volatile Future<?> deadlineWatch;

  SubscriberConnection(
      WebSocketSession session,
      Subscriber subscriber,
      Supplier<HistorySnapshot> snapshotLoader,
      BroadcastHub hub,
      RelayHubProperties properties,
      AsyncTaskExecutor writerExecutor,
      TaskScheduler keepaliveScheduler,
      Clock clock,
      RelayMetrics metrics) {
    this.session = session;
    this.subscriber = subscriber;
    this.snapshotLoader = snapshotLoader;
    this.hub = hub;
    this.properties = properties;
    this.writerExecutor = writerExecutor;
    this.keepaliveScheduler = keepaliveScheduler;
    this.clock = clock;
    this.metrics = metrics;
  }

  /**
   * Moves the upgraded socket to ACTIVE: confirms the principal, registers with the hub behind the
   * history frame and starts the writer, pinger and read-deadline watch. Any failure terminates
   * the connection instead of throwing.
   */
  public void open() {
    withSubscriberMdc(this::activate).run();
  }

  private void activate() {
    if (session.getPrincipal() == null
        || !state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATED)) {
      terminate(TerminationReason.UNAUTHENTICATED);
      return;
    }
    session.setTextMessageSizeLimit(properties.inboundMessageSizeLimit());
    session.setBinaryMessageSizeLimit(properties.inboundMessageSizeLimit());
    if (!WriteDeadlines.apply(session, properties.writeTimeout())) {
      logger.debug("write deadline not supported by session subscriber={}", subscriber.id());
    }
    refreshReadDeadline();

    try {
      hub.register(subscriber, snapshotLoader);
    } catch (RuntimeException ex) {
      logger.error("history snapshot failed subscriber={}", subscriber.id(), ex);
      terminate(TerminationReason.SNAPSHOT_FAILED);
      return;
    }
    if (!state.compareAndSet(ConnectionState.AUTHENTICATED, ConnectionState.ACTIVE)) {
      // closed by the peer while the snapshot was loading
      hub.unregister(subscriber);
      return;
    }

    try {
      writer = writerExecutor.submitCompletable(withSubscriberMdc(this::drainOutbound));
      final Instant now = keepaliveScheduler.getClock().instant();
      pinger =
          keepaliveScheduler.scheduleAtFixedRate(
              withSubscriberMdc(this::ping),
              now.plus(properties.pingInterval()),
              properties.pingInterval());
      deadlineWatch =
          keepaliveScheduler.scheduleAtFixedRate(
              withSubscriberMdc(this::checkReadDeadline),
              now.plus(properties.deadlineCheckInterval()),
              properties.deadlineCheckInterval());
    } catch (TaskRejectedException ex) {
      logger.warn("subscriber duties rejected subscriber={}", subscriber.id(), ex);
      terminate(TerminationReason.EXECUTOR_REJECTED);
      return;
    }
    if (state.get() == ConnectionState.CLOSED) {
      cancelDuties();
      return;
    }
    logger.info(
        "subscriber connected subscriber={} remote={} connected={}",
        subscriber.id(),
        session.getRemoteAddress(),
        hub.connectedCount());
  }

  public void onPong() {
    refreshReadDeadline();
  }

  public void onPeerClosed() {
    terminate(TerminationReason.PEER_CLOSED);
  }

  public void onTransportError(Throwable error) {
    logger.debug("transport error subscriber={}", subscriber.id(), error);
    terminate(TerminationReason.TRANSPORT_ERROR);
  }

  /** Idempotent; the first caller wins and later calls return immediately. */
  public void terminate(TerminationReason reason) {
    if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
      return;
    }
    hub.unregister(subscriber);
    cancelDuties();
    closeSession(reason);
    metrics.recordSubscriptionClosed(reason.tag());
    logger.info(
        "subscriber disconnected subscriber={} remote={} reason={}",
        subscriber.id(),
        session.getRemoteAddress(),
        reason.tag());
  }

  public ConnectionState state() {
    return state.get();
  }

  public Subscriber subscriber() {
    return subscriber;
  }

  Instant readDeadline() {
    return readDeadline;
  }

  void drainOutbound() {
    try {
      while (true) {
        final Optional<PushMessage> next = subscriber.outbound().take();
        if (next.isEmpty()) {
          terminate(TerminationReason.QUEUE_CLOSED);
          return;
        }
        if (!send(new TextMessage(next.get().payload()))) {
          terminate(TerminationReason.WRITE_FAILED);
          return;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      terminate(TerminationReason.SHUTDOWN);
    }
  }

  void ping() {
    if (!send(new PingMessage())) {
      terminate(TerminationReason.PING_FAILED);
    }
  }

  void checkReadDeadline() {
    final Instant deadline = readDeadline;
    if (deadline != null && clock.instant().isAfter(deadline)) {
      logger.info("read deadline passed subscriber={} deadline={}", subscriber.id(), deadline);
      terminate(TerminationReason.READ_DEADLINE);
    }
  }

  private Runnable withSubscriberMdc(Runnable duty) {
    return () -> {
      try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SUBSCRIBER_ID, subscriber.id())) {
        duty.run();
      }
    };
  }

  private void refreshReadDeadline() {
    readDeadline = clock.instant().plus(properties.readTimeout());
  }

  private boolean send(WebSocketMessage<?> message) {
    synchronized (sendLock) {
      if (!session.isOpen()) {
        return false;
      }
      try {
        session.sendMessage(message);
        return true;
      } catch (IOException | IllegalStateException ex) {
        logger.debug("send failed subscriber={}", subscriber.id(), ex);
        return false;
      }
    }
  }

  private void cancelDuties() {
    cancel(pinger);
    cancel(deadlineWatch);
    // the writer exits on its own once the queue is closed; never interrupt a blocked send
    cancel(writer);
  }

  private static void cancel(Future<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }

  private void closeSession(TerminationReason reason) {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(reason.closeStatus());
    } catch (IOException ex) {
      logger.debug("close failed subscriber={}", subscriber.id(), ex);
    }
  }
}
