/*
 * Where: Relay configuration binding
 * What: The two possible sources of the shared bearer token
 * Why: Exactly one of them must be configured; the check happens when the token is resolved
 */
package com.example.relay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay.auth")
public record RelayAuthProperties(String token, String tokenFile) {

  public RelayAuthProperties {
    token = token == null ? "" : token;
    tokenFile = tokenFile == null ? "" : tokenFile.trim();
  }

  public boolean hasToken() {
    return !token.isEmpty();
  }

  public boolean hasTokenFile() {
    return !tokenFile.isEmpty();
  }
}
