package com.example.common;

import java.util.UUID;

public final class RequestIds {
  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** Short identifier for log correlation of long-lived connections. */
  public static String newShortId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
