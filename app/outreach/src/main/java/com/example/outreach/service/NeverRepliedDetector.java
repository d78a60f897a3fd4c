package com.example.outreach.service;

import com.example.outreach.model.EmailRecord;
import org.springframework.stereotype.Component;

/** Default detector used until an inbox integration is wired in. */
@Component
public class NeverRepliedDetector implements ReplyDetector {

  @Override
  public boolean hasReplied(String ownerId, EmailRecord email) {
    return false;
  }
}
