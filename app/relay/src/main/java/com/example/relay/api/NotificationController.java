/*
 * Where: Relay API
 * What: Sender-facing endpoints for send, history, mark-seen and delete
 * Why: The bearer-authenticated HTTP surface over the notification store and hub
 */
package com.example.relay.api;

import com.example.relay.api.request.MarkSeenRequest;
import com.example.relay.api.request.SendNotificationRequest;
import com.example.relay.api.response.MarkSeenResponse;
import com.example.relay.api.response.SendNotificationResponse;
import com.example.relay.model.Notification;
import com.example.relay.service.NotificationRelayService;
import com.example.relay.service.NotificationStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class NotificationController {

  private static final Logger logger = LoggerFactory.getLogger(NotificationController.class);

  // leading integer token; trailing characters are ignored
  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

  private final NotificationRelayService relayService;
  private final NotificationStore notificationStore;
  private final ObjectMapper objectMapper;

  @PostMapping("/send")
  public ResponseEntity<SendNotificationResponse> send(
      @Valid @RequestBody SendNotificationRequest request) {
    final NotificationRelayService.SendResult result =
        relayService.send(request.title(), request.text());
    return ResponseEntity.ok(new SendNotificationResponse(result.id(), result.sentTo()));
  }

  @GetMapping("/history")
  public ResponseEntity<List<Notification>> history(
      @RequestParam(name = "limit", required = false) String limit,
      @RequestParam(name = "offset", required = false) String offset) {
    return ResponseEntity.ok(
        notificationStore.history(parseLeadingInteger(limit), parseLeadingInteger(offset)));
  }

  @PostMapping("/mark-seen")
  public ResponseEntity<MarkSeenResponse> markSeen(@RequestBody(required = false) String body) {
    final MarkSeenRequest request = readMarkSeenRequest(body);
    final List<Long> ids = request == null ? null : request.ids();
    final int marked = notificationStore.markSeen(ids);
    logger.info(
        "notifications marked seen marked={} scoped={}", marked, ids != null && !ids.isEmpty());
    return ResponseEntity.ok(new MarkSeenResponse(marked));
  }

  @DeleteMapping("/notifications")
  public ResponseEntity<Void> deleteAll() {
    notificationStore.clear();
    logger.info("notifications cleared");
    return ResponseEntity.noContent().build();
  }

  /** Returns null when the body is absent or does not decode, which marks everything. */
  private MarkSeenRequest readMarkSeenRequest(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, MarkSeenRequest.class);
    } catch (JsonProcessingException ex) {
      logger.debug(
          "mark-seen body not decodable, treating as absent reason={}", ex.getOriginalMessage());
      return null;
    }
  }

  /** Null (store default) when the value has no leading integer or does not fit an int. */
  static Integer parseLeadingInteger(String value) {
    if (value == null) {
      return null;
    }
    final Matcher matcher = LEADING_INTEGER.matcher(value);
    if (!matcher.find()) {
      return null;
    }
    try {
      return Integer.valueOf(matcher.group(1));
    } catch (NumberFormatException ex) {
      logger.debug("history parameter out of range value={}", value);
      return null;
    }
  }
}
