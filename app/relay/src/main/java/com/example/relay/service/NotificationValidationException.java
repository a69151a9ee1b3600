/*
 * Where: Relay service layer
 * What: Signals a request field that fails validation (400)
 * Why: Rejects the request before anything is persisted
 */
package com.example.relay.service;

public class NotificationValidationException extends RuntimeException {

  public NotificationValidationException(String message) {
    super(message);
  }
}
