/*
 * Where: Relay broadcast hub
 * What: In-memory identity of one live subscription and its outbound queue
 * Why: The hub fans out to queues without knowing anything about sockets
 */
package com.example.relay.hub;

public final class Subscriber {

  private final String id;
  private final OutboundQueue outbound;
  // Written under the hub lock, read by publish under the same lock.
  private long snapshotWatermark;

  public Subscriber(String id, int queueCapacity) {
    this.id = id;
    this.outbound = new OutboundQueue(queueCapacity);
  }

  public String id() {
    return id;
  }

  public OutboundQueue outbound() {
    return outbound;
  }

  long snapshotWatermark() {
    return snapshotWatermark;
  }

  void snapshotWatermark(long watermark) {
    this.snapshotWatermark = watermark;
  }

  @Override
  public String toString() {
    return "Subscriber[" + id + "]";
  }
}
