/*
 * Where: Relay data access
 * What: Inserts, pages, marks seen and clears rows of the notifications table
 * Why: Keeps SQL in one place so the store service only deals in domain terms
 */
package com.example.relay.repository;

import static com.example.common.SqliteTimestamps.fromText;
import static com.example.common.SqliteTimestamps.toText;

import com.example.relay.model.Notification;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(String title, String text, Instant createdAt) {
    final String sql =
        """
        INSERT INTO notifications (title, text, created_at)
        VALUES (:title, :text, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("title", title)
            .addValue("text", text)
            .addValue("createdAt", toText(createdAt));
    jdbcTemplate.update(sql, params);
    // last_insert_rowid() is per connection: callers must run insert inside a transaction
    final Long id =
        jdbcTemplate.queryForObject(
            "SELECT last_insert_rowid()", new MapSqlParameterSource(), Long.class);
    if (id == null || id <= 0) {
      throw new DataRetrievalFailureException("notifications insert returned no row id");
    }
    return id;
  }

  public Notification findById(long id) {
    final String sql =
        """
        SELECT id, title, text, created_at, seen_at
        FROM notifications
        WHERE id = :id
        """;
    return jdbcTemplate.queryForObject(sql, new MapSqlParameterSource("id", id), this::mapRow);
  }

  public List<Notification> findPage(int limit, int offset) {
    // id order avoids ties between rows created within the same millisecond
    final String sql =
        """
        SELECT id, title, text, created_at, seen_at
        FROM notifications
        ORDER BY id DESC
        LIMIT :limit OFFSET :offset
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSeen(Collection<Long> ids, Instant seenAt) {
    final String sql =
        """
        UPDATE notifications
        SET seen_at = :seenAt
        WHERE seen_at IS NULL
          AND id IN (:ids)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("seenAt", toText(seenAt)).addValue("ids", ids);
    return jdbcTemplate.update(sql, params);
  }

  public int markAllSeen(Instant seenAt) {
    final String sql =
        """
        UPDATE notifications
        SET seen_at = :seenAt
        WHERE seen_at IS NULL
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("seenAt", toText(seenAt)));
  }

  public int deleteAll() {
    return jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  private Notification mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Notification(
        rs.getLong("id"),
        rs.getString("title"),
        rs.getString("text"),
        fromText(rs.getString("created_at")),
        fromText(rs.getString("seen_at")));
  }
}
