/*
 * Where: Relay API integration test
 * What: Lenient query and body parsing against the real SQLite store
 * Why: Senders rely on history defaults and mark-all when their input does not parse
 */
package com.example.relay.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.relay.AbstractSqliteStoreTest;
import com.example.relay.model.Notification;
import com.example.relay.service.NotificationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class NotificationApiIntegrationTest extends AbstractSqliteStoreTest {

  private static final int STORED = 60;

  @Autowired private MockMvc mockMvc;
  @Autowired private NotificationStore notificationStore;

  @BeforeEach
  void seed() {
    notificationStore.clear();
    for (int i = 0; i < STORED; i++) {
      notificationStore.insert("build", "run " + i);
    }
  }

  @Test
  void undecodableMarkSeenBodyMarksEveryUnseenRow() throws Exception {
    mockMvc
        .perform(
            post("/mark-seen")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("not json"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.marked").value(STORED));

    assertThat(notificationStore.history(STORED, 0))
        .hasSize(STORED)
        .allSatisfy(notification -> assertThat(notification.seenAt()).isNotNull());
  }

  @Test
  void nonNumericHistoryLimitReturnsDefaultPage() throws Exception {
    final long newest = notificationStore.history(1, 0).get(0).id();

    mockMvc
        .perform(get("/history").header(HttpHeaders.AUTHORIZATION, BEARER).param("limit", "abc"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(50))
        .andExpect(jsonPath("$[0].id").value(newest));
  }

  @Test
  void scopedMarkSeenLeavesOtherRowsUnseen() throws Exception {
    final Notification newest = notificationStore.history(1, 0).get(0);

    mockMvc
        .perform(
            post("/mark-seen")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ids\":[" + newest.id() + "]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.marked").value(1));

    assertThat(notificationStore.history(STORED, 0))
        .filteredOn(notification -> notification.seenAt() == null)
        .hasSize(STORED - 1);
  }
}
