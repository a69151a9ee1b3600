package com.example.relay.websocket;

/** Lifecycle of one subscription; transitions only move forward. */
public enum ConnectionState {
  CONNECTING,
  AUTHENTICATED,
  ACTIVE,
  CLOSED
}
