/*
 * Where: Relay auth gate
 * What: Resolves the shared token from either a direct value or a token file
 * Why: A misconfigured token must stop the process before it starts serving
 */
package com.example.relay.auth;

import com.example.relay.config.RelayAuthProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TokenSourceResolver {

  private static final Logger logger = LoggerFactory.getLogger(TokenSourceResolver.class);

  private TokenSourceResolver() {}

  public static SharedToken resolve(RelayAuthProperties properties) {
    if (properties.hasToken() && properties.hasTokenFile()) {
      throw new IllegalStateException(
          "exactly one of relay.auth.token or relay.auth.token-file must be set, not both");
    }
    if (properties.hasTokenFile()) {
      return new SharedToken(readTokenFile(Path.of(properties.tokenFile())));
    }
    if (properties.hasToken()) {
      if (properties.token().isBlank()) {
        throw new IllegalStateException("relay.auth.token is blank");
      }
      logger.info("shared token loaded from relay.auth.token");
      return new SharedToken(properties.token());
    }
    throw new IllegalStateException("one of relay.auth.token or relay.auth.token-file is required");
  }

  private static String readTokenFile(Path path) {
    final String raw;
    try {
      raw = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new IllegalStateException("cannot read token file " + path, ex);
    }
    final String token = raw.trim();
    if (token.isEmpty()) {
      throw new IllegalStateException("token file is empty: " + path);
    }
    logger.info("shared token loaded from file path={}", path);
    return token;
  }
}
