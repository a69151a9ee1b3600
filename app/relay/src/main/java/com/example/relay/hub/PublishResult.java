package com.example.relay.hub;

/** Per-publish outcome counts. Dropped frames hit a full queue; skipped ones were in the snapshot. */
public record PublishResult(int delivered, int dropped, int skipped) {}
