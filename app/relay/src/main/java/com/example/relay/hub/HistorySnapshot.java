package com.example.relay.hub;

/**
 * First frame handed to a newly registered subscriber.
 *
 * @param message the encoded history frame
 * @param highestNotificationId largest id contained in the frame, {@code 0} when it is empty
 */
public record HistorySnapshot(PushMessage message, long highestNotificationId) {}
