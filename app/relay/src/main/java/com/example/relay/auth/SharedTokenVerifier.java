/*
 * Where: Relay auth gate
 * What: Checks bearer headers and subscription query tokens against the shared token
 * Why: HTTP callers can send headers, WebSocket upgrades cannot, so both forms are accepted per path
 */
package com.example.relay.auth;

public class SharedTokenVerifier {

  private static final String BEARER_PREFIX = "Bearer ";

  private final SharedToken sharedToken;

  public SharedTokenVerifier(SharedToken sharedToken) {
    this.sharedToken = sharedToken;
  }

  /** Exact match of {@code Authorization: Bearer <token>}. */
  public boolean verifyAuthorizationHeader(String headerValue) {
    if (headerValue == null || !headerValue.startsWith(BEARER_PREFIX)) {
      return false;
    }
    return sharedToken.matches(headerValue.substring(BEARER_PREFIX.length()));
  }

  /** Exact match of the {@code token} query parameter. */
  public boolean verifyQueryToken(String token) {
    return sharedToken.matches(token);
  }
}
