package com.example.outreach.service;

/** Transport boundary. Returns the message id or throws {@link DeliveryException}. */
public interface MailDelivery {
  String deliver(String ownerId, String to, String subject, String body);
}
