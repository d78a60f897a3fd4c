package com.example.outreach.service;

import com.example.outreach.model.EmailRecord;

/**
 * Outcome of a stage transition.
 *
 * @param email state of the advanced email; null once the recipient's emails were purged
 * @param nextStageEmail email spawned for the next stage, if any
 * @param alreadyAdvanced true when the call was a no-op because the email had been sent before
 * @param completed true when the recipient finished the last stage and was archived
 * @param nextStageError why the next stage could not be created, if it failed
 */
public record AdvanceResult(
    EmailRecord email,
    EmailRecord nextStageEmail,
    boolean alreadyAdvanced,
    boolean completed,
    String nextStageError) {

  static AdvanceResult noop(EmailRecord current) {
    return new AdvanceResult(current, null, true, false, null);
  }
}
