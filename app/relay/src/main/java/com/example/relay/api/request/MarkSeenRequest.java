/*
 * Where: Relay API request DTO
 * What: Optional body of POST /mark-seen
 * Why: Absent or empty ids means every unseen notification
 */
package com.example.relay.api.request;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record is only read once by the controller")
public record MarkSeenRequest(List<Long> ids) {}
