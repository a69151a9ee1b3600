/*
 * Where: Relay configuration binding
 * What: Capacity, queue and keepalive settings for the subscription hub
 * Why: Timings are tunable per environment and checked at startup
 */
package com.example.relay.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "relay.hub")
@Validated
public record RelayHubProperties(
    @DefaultValue("15") @Positive int maxSubscribers,
    @DefaultValue("64") @Positive int outboundQueueCapacity,
    @DefaultValue("100") @Positive int historySnapshotSize,
    @DefaultValue("30s") @NotNull Duration pingInterval,
    @DefaultValue("70s") @NotNull Duration readTimeout,
    @DefaultValue("10s") @NotNull Duration writeTimeout,
    @DefaultValue("5s") @NotNull Duration deadlineCheckInterval,
    @DefaultValue("512") @Positive int inboundMessageSizeLimit) {

  @AssertTrue(message = "relay.hub durations must be positive")
  public boolean isDurationsPositive() {
    return isPositive(pingInterval)
        && isPositive(readTimeout)
        && isPositive(writeTimeout)
        && isPositive(deadlineCheckInterval);
  }

  @AssertTrue(message = "relay.hub.read-timeout must be longer than relay.hub.ping-interval")
  public boolean isReadTimeoutLongerThanPingInterval() {
    // a pong can only refresh the deadline if a ping goes out before it expires
    if (readTimeout == null || pingInterval == null) {
      return true;
    }
    return readTimeout.compareTo(pingInterval) > 0;
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
