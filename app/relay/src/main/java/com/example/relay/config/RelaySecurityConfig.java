/*
 * Where: Relay security configuration
 * What: Wires the shared token gate into a stateless filter chain
 * Why: Token checks run before any handler, health stays reachable for probes
 */
package com.example.relay.config;

import com.example.relay.auth.JsonAuthenticationEntryPoint;
import com.example.relay.auth.SharedTokenAuthenticationFilter;
import com.example.relay.auth.SharedTokenVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
public class RelaySecurityConfig {

  @Bean
  UserDetailsService userDetailsService() {
    // no user store; keeps Boot from generating a default password
    return new InMemoryUserDetailsManager();
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, SharedTokenVerifier sharedTokenVerifier, ObjectMapper objectMapper)
      throws Exception {
    final SharedTokenAuthenticationFilter tokenFilter =
        new SharedTokenAuthenticationFilter(sharedTokenVerifier);
    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .logout(logout -> logout.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(
            exceptions ->
                exceptions.authenticationEntryPoint(new JsonAuthenticationEntryPoint(objectMapper)))
        .addFilterBefore(tokenFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/health", "/error", "/actuator/health", "/actuator/health/**")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, SharedTokenAuthenticationFilter.SUBSCRIPTION_PATH)
                    .hasRole("SUBSCRIBER")
                    .anyRequest()
                    .hasRole("SENDER"));
    return http.build();
  }
}
