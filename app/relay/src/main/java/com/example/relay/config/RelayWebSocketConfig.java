/*
 * Where: Relay configuration
 * What: Maps the subscription endpoint at /ws
 * Why: Auth runs in the security filter chain before the handshake reaches this mapping
 */
package com.example.relay.config;

import com.example.relay.auth.SharedTokenAuthenticationFilter;
import com.example.relay.websocket.SubscriptionHandshakeInterceptor;
import com.example.relay.websocket.SubscriptionWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class RelayWebSocketConfig implements WebSocketConfigurer {

  private final SubscriptionWebSocketHandler handler;
  private final SubscriptionHandshakeInterceptor handshakeInterceptor;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(handler, SharedTokenAuthenticationFilter.SUBSCRIPTION_PATH)
        .addInterceptors(handshakeInterceptor)
        .setAllowedOriginPatterns("*");
  }
}
