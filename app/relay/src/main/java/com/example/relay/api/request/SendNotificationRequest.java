/*
 * Where: Relay API request DTO
 * What: Body of POST /send
 * Why: text is required; title may be omitted
 */
package com.example.relay.api.request;

import jakarta.validation.constraints.NotBlank;

public record SendNotificationRequest(String title, @NotBlank String text) {}
