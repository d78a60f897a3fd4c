package com.example.outreach.service;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Simulated transport: logs the send and hands back a synthetic message id. */
@Component
public class LocalMailDelivery implements MailDelivery {

  private static final Logger logger = LoggerFactory.getLogger(LocalMailDelivery.class);

  @Override
  public String deliver(String ownerId, String to, String subject, String body) {
    final String messageId = "<" + UUID.randomUUID() + "@outreach.local>";
    logger.info("mail simulated send ownerId={} messageId={}", ownerId, messageId);
    return messageId;
  }
}
