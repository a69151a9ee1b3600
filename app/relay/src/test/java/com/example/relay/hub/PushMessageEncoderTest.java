package com.example.relay.hub;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.relay.model.Notification;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class PushMessageEncoderTest {

  private static final Instant CREATED = Instant.parse("2026-02-24T12:00:00Z");

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  private final PushMessageEncoder encoder = new PushMessageEncoder(objectMapper);

  @Test
  void historyFrameListsNotificationsAndTracksHighestId() throws Exception {
    final HistorySnapshot snapshot =
        encoder.history(
            List.of(
                new Notification(3, "t3", "x", CREATED, null),
                new Notification(2, "t2", "y", CREATED, CREATED)));

    final JsonNode frame = objectMapper.readTree(snapshot.message().payload());
    assertThat(snapshot.highestNotificationId()).isEqualTo(3L);
    assertThat(snapshot.message().notificationId()).isZero();
    assertThat(frame.get("type").asText()).isEqualTo("history");
    assertThat(frame.get("notifications")).hasSize(2);
    assertThat(frame.get("notifications").get(0).get("id").asLong()).isEqualTo(3L);
    assertThat(frame.get("notifications").get(1).get("seen_at").asText())
        .isEqualTo("2026-02-24T12:00:00Z");
  }

  @Test
  void emptyHistoryHasZeroWatermark() throws Exception {
    final HistorySnapshot snapshot = encoder.history(List.of());

    assertThat(snapshot.highestNotificationId()).isZero();
    assertThat(objectMapper.readTree(snapshot.message().payload()).get("notifications")).isEmpty();
  }

  @Test
  void notificationFrameUsesSnakeCaseWithoutSeenAt() throws Exception {
    final PushMessage message =
        encoder.notification(new Notification(2, "A", "B", CREATED, null));

    final JsonNode frame = objectMapper.readTree(message.payload());
    assertThat(message.notificationId()).isEqualTo(2L);
    assertThat(frame.get("type").asText()).isEqualTo("notification");
    assertThat(frame.get("created_at").asText()).isEqualTo("2026-02-24T12:00:00Z");
    assertThat(frame.has("seen_at")).isFalse();
  }
}
