/*
 * Where: Relay repository integration test
 * What: Insert, paging, seen-state and clear queries against SQLite
 * Why: Id assignment and the one-way seen transition depend on SQLite behavior
 */
package com.example.relay.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.relay.AbstractSqliteStoreTest;
import com.example.relay.model.Notification;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
class NotificationRepositoryTest extends AbstractSqliteStoreTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private NotificationRepository notificationRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private TransactionTemplate transactionTemplate;

  @BeforeEach
  void cleanup() {
    notificationRepository.deleteAll();
  }

  @Test
  void insertAssignsIncreasingIdsAndStoresUtcText() {
    final long first = insert("a", "one", BASE_TIME);
    final long second = insert("b", "two", BASE_TIME.plusMillis(250));

    assertThat(second).isGreaterThan(first);
    final String createdAt =
        jdbcTemplate.queryForObject(
            "SELECT created_at FROM notifications WHERE id = :id",
            new MapSqlParameterSource("id", second),
            String.class);
    assertThat(createdAt).isEqualTo("2026-01-17 00:00:00.250");
    assertThat(notificationRepository.findById(second).seenAt()).isNull();
  }

  @Test
  void idsAreNotReusedAfterDeleteAll() {
    final long before = insert("", "first", BASE_TIME);
    notificationRepository.deleteAll();

    final long after = insert("", "second", BASE_TIME);

    assertThat(after).isGreaterThan(before);
  }

  @Test
  void findPageReturnsNewestFirstWithOffset() {
    final long first = insert("", "1", BASE_TIME);
    final long second = insert("", "2", BASE_TIME);
    final long third = insert("", "3", BASE_TIME);

    assertThat(notificationRepository.findPage(2, 0))
        .extracting(Notification::id)
        .containsExactly(third, second);
    assertThat(notificationRepository.findPage(2, 2))
        .extracting(Notification::id)
        .containsExactly(first);
  }

  @Test
  void markSeenOnlyTouchesUnseenListedRows() {
    final long first = insert("", "1", BASE_TIME);
    final long second = insert("", "2", BASE_TIME);
    insert("", "3", BASE_TIME);

    assertThat(notificationRepository.markSeen(List.of(first, second), BASE_TIME)).isEqualTo(2);
    assertThat(notificationRepository.markSeen(List.of(first), BASE_TIME.plusSeconds(60)))
        .isZero();
    assertThat(notificationRepository.findById(first).seenAt()).isEqualTo(BASE_TIME);
    assertThat(countUnseen()).isEqualTo(1);
  }

  @Test
  void markAllSeenCountsOnlyPreviouslyUnseenRows() {
    final long first = insert("", "1", BASE_TIME);
    insert("", "2", BASE_TIME);
    notificationRepository.markSeen(List.of(first), BASE_TIME);

    assertThat(notificationRepository.markAllSeen(BASE_TIME)).isEqualTo(1);
    assertThat(notificationRepository.markAllSeen(BASE_TIME)).isZero();
  }

  @Test
  void legacyCurrentTimestampRowsAreReadable() {
    jdbcTemplate.update(
        "INSERT INTO notifications (title, text) VALUES ('legacy', 'old row')",
        new MapSqlParameterSource());

    final List<Notification> page = notificationRepository.findPage(1, 0);

    assertThat(page).hasSize(1);
    assertThat(page.get(0).createdAt()).isNotNull();
    assertThat(page.get(0).seenAt()).isNull();
  }

  private long insert(String title, String text, Instant createdAt) {
    final Long id =
        transactionTemplate.execute(
            status -> notificationRepository.insert(title, text, createdAt));
    return id == null ? -1 : id;
  }

  private int countUnseen() {
    return jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM notifications WHERE seen_at IS NULL",
        new MapSqlParameterSource(),
        Integer.class);
  }
}
