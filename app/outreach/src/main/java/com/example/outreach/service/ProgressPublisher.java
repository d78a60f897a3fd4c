package com.example.outreach.service;

import com.example.outreach.model.ProgressEvent;

/** Output sink for live job progress. */
public interface ProgressPublisher {
  void publish(String ownerId, ProgressEvent event);
}
