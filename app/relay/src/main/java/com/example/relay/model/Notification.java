/*
 * Where: Relay domain model
 * What: Snapshot of one row of the notifications table
 * Why: Shared by the HTTP history API and the subscription history snapshot
 */
package com.example.relay.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Notification(long id, String title, String text, Instant createdAt, Instant seenAt) {}
