/*
 * Where: Relay logging configuration test
 * What: The JSON encoder and the MDC correlation fields are present in logback-spring.xml
 * Why: A config edit must not silently drop structured logs or request/subscriber correlation
 */
package com.example.relay;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonAndCorrelationFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"request_id\":\"%X{request_id:-}\"");
    assertThat(configText).contains("\"client_ip\":\"%X{client_ip:-}\"");
    assertThat(configText).contains("\"subscriber_id\":\"%X{subscriber_id:-}\"");
  }
}
