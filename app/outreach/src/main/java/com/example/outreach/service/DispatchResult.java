package com.example.outreach.service;

/** A delivered email, the governor's warning at send time and the resulting stage transition. */
public record DispatchResult(String messageId, String quotaWarning, AdvanceResult advance) {}
