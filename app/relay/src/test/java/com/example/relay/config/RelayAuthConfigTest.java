/*
 * Where: Relay auth configuration test
 * What: Context startup succeeds or fails depending on the configured token source
 * Why: Token misconfiguration must stop the process instead of serving unauthenticated
 */
package com.example.relay.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.relay.auth.SharedTokenVerifier;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

class RelayAuthConfigTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(AuthOnlyConfiguration.class);

  @Test
  void directTokenStartsContext() {
    contextRunner
        .withPropertyValues("relay.auth.token=abc")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              assertThat(
                      context
                          .getBean(SharedTokenVerifier.class)
                          .verifyAuthorizationHeader("Bearer abc"))
                  .isTrue();
            });
  }

  @Test
  void missingTokenFailsStartup() {
    contextRunner.run(
        context ->
            assertThat(context)
                .hasFailed()
                .getFailure()
                .rootCause()
                .hasMessageContaining("relay.auth.token"));
  }

  @Test
  void bothSourcesFailStartup() {
    contextRunner
        .withPropertyValues("relay.auth.token=abc", "relay.auth.token-file=/tmp/token")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(RelayAuthProperties.class)
  @Import(RelayAuthConfig.class)
  static class AuthOnlyConfiguration {}
}
