/*
 * Where: Relay subscription endpoint
 * What: Refuses the upgrade with 503 when the subscriber cap is reached
 * Why: Existing subscribers are never evicted to make room
 */
package com.example.relay.websocket;

import com.example.relay.api.ApiErrorCode;
import com.example.relay.api.ApiErrorResponse;
import com.example.relay.service.RelayMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

@Component
@RequiredArgsConstructor
public class SubscriptionHandshakeInterceptor implements HandshakeInterceptor {

  private static final Logger logger =
      LoggerFactory.getLogger(SubscriptionHandshakeInterceptor.class);

  static final String REJECT_REASON_CAPACITY = "capacity";

  private final SubscriptionAdmission admission;
  private final RelayMetrics metrics;
  private final ObjectMapper objectMapper;

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes)
      throws IOException {
    try {
      admission.admit();
      return true;
    } catch (SubscriberCapacityException ex) {
      logger.warn(
          "subscription rejected: capacity remote={} connected={} max={}",
          request.getRemoteAddress(),
          ex.connected(),
          ex.maxSubscribers());
      metrics.recordSubscriptionRejected(REJECT_REASON_CAPACITY);
      response.setStatusCode(HttpStatus.SERVICE_UNAVAILABLE);
      response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
      response
          .getBody()
          .write(
              objectMapper.writeValueAsBytes(
                  new ApiErrorResponse(ApiErrorCode.CAPACITY_EXCEEDED, ex.getMessage())));
      return false;
    }
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {
    if (exception != null) {
      logger.warn("subscription handshake failed remote={}", request.getRemoteAddress(), exception);
    }
  }
}
