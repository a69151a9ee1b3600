/*
 * Where: Relay API
 * What: Error codes carried in every error response
 * Why: Callers can branch on the cause without parsing messages
 */
package com.example.relay.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  CAPACITY_EXCEEDED,
  INTERNAL_ERROR
}
