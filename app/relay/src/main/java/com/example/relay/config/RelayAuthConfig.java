/*
 * Where: Relay security configuration
 * What: Resolves the shared token once at startup and exposes its verifier
 * Why: A bad token source fails the context refresh, so the process never starts serving
 */
package com.example.relay.config;

import com.example.relay.auth.SharedToken;
import com.example.relay.auth.SharedTokenVerifier;
import com.example.relay.auth.TokenSourceResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RelayAuthConfig {

  @Bean
  SharedToken sharedToken(RelayAuthProperties properties) {
    return TokenSourceResolver.resolve(properties);
  }

  @Bean
  SharedTokenVerifier sharedTokenVerifier(SharedToken sharedToken) {
    return new SharedTokenVerifier(sharedToken);
  }
}
