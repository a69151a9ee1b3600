/*
 * Where: Relay service layer
 * What: Wraps a storage-layer failure of the notification log (500)
 * Why: Callers see one internal error type regardless of the JDBC cause
 */
package com.example.relay.service;

public class NotificationStoreException extends RuntimeException {

  private final String operation;

  public NotificationStoreException(String operation, Throwable cause) {
    super("notification store " + operation + " failed", cause);
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }
}
