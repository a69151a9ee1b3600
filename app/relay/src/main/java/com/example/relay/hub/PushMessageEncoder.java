/*
 * Where: Relay broadcast hub
 * What: Encodes the history and notification subscription frames as JSON
 * Why: Each frame is serialized once and shared by every subscriber queue
 */
package com.example.relay.hub;

import com.example.relay.model.Notification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PushMessageEncoder {

  static final String TYPE_HISTORY = "history";
  static final String TYPE_NOTIFICATION = "notification";

  private final ObjectMapper objectMapper;

  /** Builds the snapshot frame; {@code notifications} is expected newest first. */
  public HistorySnapshot history(List<Notification> notifications) {
    final long highestId =
        notifications.stream().mapToLong(Notification::id).max().orElse(0L);
    final String payload = write(new HistoryFrame(TYPE_HISTORY, List.copyOf(notifications)));
    return new HistorySnapshot(PushMessage.unattributed(payload), highestId);
  }

  public PushMessage notification(Notification notification) {
    final String payload =
        write(
            new NotificationFrame(
                TYPE_NOTIFICATION,
                notification.id(),
                notification.title(),
                notification.text(),
                notification.createdAt()));
    return new PushMessage(notification.id(), payload);
  }

  private String write(Object frame) {
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("subscription frame serialization failure", ex);
    }
  }

  record HistoryFrame(String type, List<Notification> notifications) {}

  // live frames carry no seen_at: a freshly inserted notification is unseen
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record NotificationFrame(String type, long id, String title, String text, Instant createdAt) {}
}
