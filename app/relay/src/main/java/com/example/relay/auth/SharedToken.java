/*
 * Where: Relay auth gate
 * What: The resolved shared bearer token
 * Why: Keeps the secret out of toString and compares it in constant time
 */
package com.example.relay.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public final class SharedToken {

  private final byte[] value;

  public SharedToken(String value) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("shared token must not be empty");
    }
    this.value = value.getBytes(StandardCharsets.UTF_8);
  }

  public boolean matches(String candidate) {
    if (candidate == null) {
      return false;
    }
    return MessageDigest.isEqual(value, candidate.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String toString() {
    return "SharedToken[****]";
  }
}
