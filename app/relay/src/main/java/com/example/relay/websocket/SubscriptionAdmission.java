/*
 * Where: Relay subscription endpoint
 * What: Subscriber cap check applied before the protocol upgrade
 * Why: Refusing at the handshake keeps the client's error a plain HTTP response
 */
package com.example.relay.websocket;

import com.example.relay.config.RelayHubProperties;
import com.example.relay.hub.BroadcastHub;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * The count is read without reserving a slot, so two upgrades racing at {@code max - 1} can both
 * be admitted. The hub never refuses a registration.
 */
@Component
@RequiredArgsConstructor
public class SubscriptionAdmission {

  private final BroadcastHub hub;
  private final RelayHubProperties properties;

  public void admit() {
    final int connected = hub.connectedCount();
    if (connected >= properties.maxSubscribers()) {
      throw new SubscriberCapacityException(connected, properties.maxSubscribers());
    }
  }
}
