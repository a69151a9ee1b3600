/*
 * Where: Relay API
 * What: Plain liveness response for load balancers and scripts
 * Why: Needs no token and touches neither the store nor the hub
 */
package com.example.relay.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  @GetMapping("/health")
  public String health() {
    return "ok";
  }
}
