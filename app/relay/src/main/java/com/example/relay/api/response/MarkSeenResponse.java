package com.example.relay.api.response;

public record MarkSeenResponse(int marked) {}
