/*
 * Where: Outreach service layer
 * What: publishes job progress events to NATS, one subject per owner
 * Why: UI gateways subscribe per owner and push events over their own channel
 */
package com.example.outreach.service;

import com.example.common.TraceIds;
import com.example.outreach.config.OutreachNatsProperties;
import com.example.outreach.model.ProgressEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.impl.Headers;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsProgressPublisher implements ProgressPublisher {

  private final Connection connection;
  private final OutreachNatsProperties properties;
  private final ObjectMapper objectMapper;

  public NatsProgressPublisher(
      Connection connection, OutreachNatsProperties properties, ObjectMapper objectMapper) {
    this.connection = connection;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(String ownerId, ProgressEvent event) {
    if (ownerId == null || ownerId.isBlank()) {
      throw new IllegalArgumentException("ownerId is required");
    }
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize progress event", ex);
    }
    final Headers headers = new Headers();
    headers.add("trace-id", TraceIds.currentOrNew());
    connection.publish(subjectFor(ownerId), headers, body);
  }

  String subjectFor(String ownerId) {
    return properties.subjectPrefix() + "." + ownerId;
  }
}
