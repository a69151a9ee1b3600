package com.example.relay.api;

public record ApiErrorResponse(ApiErrorCode code, String message) {}
