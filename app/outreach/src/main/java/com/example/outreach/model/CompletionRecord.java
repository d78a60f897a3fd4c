package com.example.outreach.model;

import java.time.Instant;

/** Immutable trace of a recipient that went through every stage. */
public record CompletionRecord(
    String ownerId, String recipientAddress, String recipientName, Instant completedAt) {}
