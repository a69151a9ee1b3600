/*
 * Where: Relay subscription lifecycle
 * What: Signals a subscription attempt at or above the subscriber cap (503)
 * Why: The attempt is refused before the upgrade so existing subscribers are untouched
 */
package com.example.relay.websocket;

public class SubscriberCapacityException extends RuntimeException {

  private final int connected;
  private final int maxSubscribers;

  public SubscriberCapacityException(int connected, int maxSubscribers) {
    super("too many connections");
    this.connected = connected;
    this.maxSubscribers = maxSubscribers;
  }

  public int connected() {
    return connected;
  }

  public int maxSubscribers() {
    return maxSubscribers;
  }
}
