/*
 * Where: Relay service layer
 * What: Append-only notification log with a one-way seen-state transition
 * Why: Owns the insert/history/markSeen/clear rules so the HTTP and subscription paths agree
 */
package com.example.relay.service;

import com.example.relay.model.Notification;
import com.example.relay.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationStore {

  public static final int DEFAULT_HISTORY_LIMIT = 50;
  public static final int MAX_HISTORY_LIMIT = 100;

  private final NotificationRepository notificationRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public Notification insert(String title, String text) {
    if (text == null || text.isBlank()) {
      throw new NotificationValidationException("text is required");
    }
    final String normalizedTitle = title == null ? "" : title;
    final Instant createdAt = Instant.now(clock);
    return guard(
        "insert",
        () ->
            transactionTemplate.execute(
                status -> {
                  final long id = notificationRepository.insert(normalizedTitle, text, createdAt);
                  return notificationRepository.findById(id);
                }));
  }

  public List<Notification> history(Integer limit, Integer offset) {
    final int effectiveLimit = normalizeLimit(limit);
    final int effectiveOffset = offset == null || offset < 0 ? 0 : offset;
    final List<Notification> page =
        guard("history", () -> notificationRepository.findPage(effectiveLimit, effectiveOffset));
    return page == null ? List.of() : page;
  }

  /**
   * Sets {@code seen_at} on unseen rows. A null or empty {@code ids} marks every unseen row.
   *
   * @return number of rows that changed state
   */
  public int markSeen(Collection<Long> ids) {
    final Instant seenAt = Instant.now(clock);
    if (ids == null || ids.isEmpty()) {
      return guard("markSeen", () -> notificationRepository.markAllSeen(seenAt));
    }
    return guard("markSeen", () -> notificationRepository.markSeen(ids, seenAt));
  }

  public void clear() {
    guard("clear", notificationRepository::deleteAll);
  }

  static int normalizeLimit(Integer limit) {
    if (limit == null) {
      return DEFAULT_HISTORY_LIMIT;
    }
    return limit < 1 ? MAX_HISTORY_LIMIT : limit;
  }

  private <T> T guard(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException ex) {
      throw new NotificationStoreException(operation, ex);
    }
  }
}
