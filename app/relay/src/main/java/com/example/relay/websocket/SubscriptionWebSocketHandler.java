/*
 * Where: Relay subscription endpoint
 * What: Routes container callbacks for /ws sessions to their SubscriberConnection
 * Why: Subscribers send nothing meaningful; only pongs and closes matter inbound
 */
package com.example.relay.websocket;

import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

@Component
@RequiredArgsConstructor
public class SubscriptionWebSocketHandler extends AbstractWebSocketHandler {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionWebSocketHandler.class);

  private final SubscriberConnectionFactory connectionFactory;
  private final ConcurrentMap<String, SubscriberConnection> connections = new ConcurrentHashMap<>();

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    final SubscriberConnection connection = connectionFactory.create(session);
    connections.put(session.getId(), connection);
    connection.open();
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    // inbound text has no meaning on this endpoint
    logger.debug(
        "ignored inbound text session={} length={}", session.getId(), message.getPayloadLength());
  }

  @Override
  protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
    logger.debug(
        "ignored inbound binary session={} length={}", session.getId(), message.getPayloadLength());
  }

  @Override
  protected void handlePongMessage(WebSocketSession session, PongMessage message) {
    final SubscriberConnection connection = connections.get(session.getId());
    if (connection != null) {
      connection.onPong();
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    final SubscriberConnection connection = connections.get(session.getId());
    if (connection != null) {
      connection.onTransportError(exception);
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    final SubscriberConnection connection = connections.remove(session.getId());
    if (connection != null) {
      logger.debug("peer closed session={} code={}", session.getId(), status.getCode());
      connection.onPeerClosed();
    }
  }

  int openConnections() {
    return connections.size();
  }

  @PreDestroy
  public void shutdown() {
    final List<SubscriberConnection> open = List.copyOf(connections.values());
    connections.clear();
    for (SubscriberConnection connection : open) {
      connection.terminate(TerminationReason.SHUTDOWN);
    }
    if (!open.isEmpty()) {
      logger.info("closed subscribers on shutdown count={}", open.size());
    }
  }
}
