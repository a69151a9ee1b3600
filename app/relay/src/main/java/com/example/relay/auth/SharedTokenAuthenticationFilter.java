/*
 * Where: Relay auth gate
 * What: Establishes the sender/subscriber principal from the shared token
 * Why: Every entry point except health is authenticated before any handler runs
 */
package com.example.relay.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class SharedTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(SharedTokenAuthenticationFilter.class);

  public static final String SUBSCRIPTION_PATH = "/ws";
  public static final String TOKEN_QUERY_PARAMETER = "token";
  static final String SENDER_ROLE = "ROLE_SENDER";
  static final String SUBSCRIBER_ROLE = "ROLE_SUBSCRIBER";

  private final SharedTokenVerifier verifier;

  public SharedTokenAuthenticationFilter(SharedTokenVerifier verifier) {
    this.verifier = verifier;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final UsernamePasswordAuthenticationToken authentication = resolveAuthentication(request);
    if (authentication != null) {
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "shared token not established method={} path={}",
          request.getMethod(),
          request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private UsernamePasswordAuthenticationToken resolveAuthentication(HttpServletRequest request) {
    if (isSubscriptionRequest(request)) {
      // upgrade requests cannot carry custom headers, so the token travels in the query string
      if (!verifier.verifyQueryToken(request.getParameter(TOKEN_QUERY_PARAMETER))) {
        return null;
      }
      return new UsernamePasswordAuthenticationToken(
          "subscriber", "N/A", List.of(new SimpleGrantedAuthority(SUBSCRIBER_ROLE)));
    }
    if (!verifier.verifyAuthorizationHeader(request.getHeader(HttpHeaders.AUTHORIZATION))) {
      return null;
    }
    return new UsernamePasswordAuthenticationToken(
        "sender", "N/A", List.of(new SimpleGrantedAuthority(SENDER_ROLE)));
  }

  private boolean isSubscriptionRequest(HttpServletRequest request) {
    return "GET".equals(request.getMethod()) && SUBSCRIPTION_PATH.equals(request.getRequestURI());
  }
}
