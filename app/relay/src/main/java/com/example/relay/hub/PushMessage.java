package com.example.relay.hub;

/**
 * Serialized outbound frame.
 *
 * @param notificationId id of the carried notification, {@code 0} for frames that carry none
 * @param payload JSON text written to the subscriber as-is
 */
public record PushMessage(long notificationId, String payload) {

  public static PushMessage unattributed(String payload) {
    return new PushMessage(0L, payload);
  }
}
