/*
 * Where: Relay service layer
 * What: Persists a sent notification and fans it out to live subscribers
 * Why: The row must exist before any subscriber sees its id
 */
package com.example.relay.service;

import com.example.relay.hub.BroadcastHub;
import com.example.relay.hub.PublishResult;
import com.example.relay.hub.PushMessageEncoder;
import com.example.relay.model.Notification;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRelayService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRelayService.class);

  private final NotificationStore notificationStore;
  private final BroadcastHub broadcastHub;
  private final PushMessageEncoder encoder;
  private final RelayMetrics metrics;

  /**
   * Stores the notification and hands it to every registered subscriber's queue.
   *
   * <p>{@code sentTo} is the subscriber count right after fanout. Subscribers whose queue was full
   * are still counted; the response does not promise delivery.
   */
  public SendResult send(String title, String text) {
    final Notification notification = notificationStore.insert(title, text);
    final PublishResult published = broadcastHub.publish(encoder.notification(notification));
    final int sentTo = broadcastHub.connectedCount();
    metrics.recordNotificationSent();
    logger.info(
        "notification sent id={} sent_to={} dropped={} title={}",
        notification.id(),
        sentTo,
        published.dropped(),
        notification.title());
    return new SendResult(notification.id(), sentTo);
  }

  public record SendResult(long id, int sentTo) {}
}
