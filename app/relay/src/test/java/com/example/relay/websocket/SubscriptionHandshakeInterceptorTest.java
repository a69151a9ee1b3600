package com.example.relay.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.relay.config.RelayHubProperties;
import com.example.relay.hub.BroadcastHub;
import com.example.relay.hub.Subscriber;
import com.example.relay.service.RelayMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

class SubscriptionHandshakeInterceptorTest {

  private static final int MAX_SUBSCRIBERS = 15;

  private SimpleMeterRegistry registry;
  private BroadcastHub hub;
  private SubscriptionHandshakeInterceptor interceptor;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    final RelayMetrics metrics = new RelayMetrics(registry);
    hub = new BroadcastHub(metrics);
    final RelayHubProperties properties =
        new RelayHubProperties(
            MAX_SUBSCRIBERS,
            64,
            100,
            Duration.ofSeconds(30),
            Duration.ofSeconds(70),
            Duration.ofSeconds(10),
            Duration.ofSeconds(5),
            512);
    interceptor =
        new SubscriptionHandshakeInterceptor(
            new SubscriptionAdmission(hub, properties), metrics, new ObjectMapper());
  }

  @Test
  void admitsFifteenthSubscriber() throws Exception {
    registerSubscribers(MAX_SUBSCRIBERS - 1);
    final MockHttpServletResponse servletResponse = new MockHttpServletResponse();

    final boolean admitted = handshake(servletResponse);

    assertThat(admitted).isTrue();
    assertThat(servletResponse.getStatus()).isEqualTo(200);
  }

  @Test
  void rejectsSixteenthWith503WithoutDisturbingExistingSubscribers() throws Exception {
    final List<Subscriber> active = registerSubscribers(MAX_SUBSCRIBERS);
    final MockHttpServletResponse servletResponse = new MockHttpServletResponse();

    final boolean admitted = handshake(servletResponse);

    assertThat(admitted).isFalse();
    assertThat(servletResponse.getStatus()).isEqualTo(503);
    assertThat(servletResponse.getContentAsString())
        .contains("\"code\":\"CAPACITY_EXCEEDED\"")
        .contains("too many connections");
    assertThat(hub.connectedCount()).isEqualTo(15);
    assertThat(active).noneMatch(subscriber -> subscriber.outbound().isClosed());
    assertThat(
            registry
                .get("relay.subscription.rejected.total")
                .tag("reason", "capacity")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  private boolean handshake(MockHttpServletResponse servletResponse) throws Exception {
    final MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws");
    final ServletServerHttpResponse response = new ServletServerHttpResponse(servletResponse);
    final boolean admitted =
        interceptor.beforeHandshake(
            new ServletServerHttpRequest(servletRequest),
            response,
            mock(WebSocketHandler.class),
            new HashMap<>());
    response.flush();
    return admitted;
  }

  private List<Subscriber> registerSubscribers(int count) {
    final List<Subscriber> registered = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      final Subscriber subscriber = new Subscriber("s" + i, 4);
      hub.register(subscriber);
      registered.add(subscriber);
    }
    return registered;
  }
}
