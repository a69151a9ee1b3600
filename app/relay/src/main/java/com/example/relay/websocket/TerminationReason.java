package com.example.relay.websocket;

import org.springframework.web.socket.CloseStatus;

/** Why a subscription ended; {@code tag} is the metric/log label. */
public enum TerminationReason {
  PEER_CLOSED("peer_closed", CloseStatus.NORMAL),
  TRANSPORT_ERROR("transport_error", CloseStatus.SERVER_ERROR),
  READ_DEADLINE("read_deadline", CloseStatus.SESSION_NOT_RELIABLE),
  WRITE_FAILED("write_failed", CloseStatus.SESSION_NOT_RELIABLE),
  PING_FAILED("ping_failed", CloseStatus.SESSION_NOT_RELIABLE),
  QUEUE_CLOSED("queue_closed", CloseStatus.NORMAL),
  SNAPSHOT_FAILED("snapshot_failed", CloseStatus.SERVER_ERROR),
  UNAUTHENTICATED("unauthenticated", CloseStatus.POLICY_VIOLATION),
  EXECUTOR_REJECTED("executor_rejected", CloseStatus.SERVICE_OVERLOAD),
  SHUTDOWN("shutdown", CloseStatus.GOING_AWAY);

  private final String tag;
  private final CloseStatus closeStatus;

  TerminationReason(String tag, CloseStatus closeStatus) {
    this.tag = tag;
    this.closeStatus = closeStatus;
  }

  public String tag() {
    return tag;
  }

  public CloseStatus closeStatus() {
    return closeStatus;
  }
}
