package com.example.outreach.service;

import com.example.outreach.model.EmailRecord;

/** Tells whether a recipient answered one of the owner's emails. */
public interface ReplyDetector {
  boolean hasReplied(String ownerId, EmailRecord email);
}
