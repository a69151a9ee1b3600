package com.example.relay.websocket;

import jakarta.websocket.Session;
import java.time.Duration;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;

/** Applies a blocking-send deadline to the container's native session. */
final class WriteDeadlines {

  // Tomcat reads this user property on every blocking send, value in milliseconds
  static final String TOMCAT_BLOCKING_SEND_TIMEOUT =
      "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

  private WriteDeadlines() {}

  static boolean apply(WebSocketSession session, Duration timeout) {
    if (!(session instanceof NativeWebSocketSession nativeSession)) {
      return false;
    }
    final Session standardSession = nativeSession.getNativeSession(Session.class);
    if (standardSession == null) {
      return false;
    }
    standardSession.getUserProperties().put(TOMCAT_BLOCKING_SEND_TIMEOUT, timeout.toMillis());
    return true;
  }
}
