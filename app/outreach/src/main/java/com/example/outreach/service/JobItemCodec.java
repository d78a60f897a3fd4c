package com.example.outreach.service;

import com.example.outreach.model.Contact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** JSON form of the ordered items a job stores so it can resume after a restart. */
@Component
@RequiredArgsConstructor
public class JobItemCodec {

  private static final TypeReference<List<Contact>> CONTACTS = new TypeReference<>() {};
  private static final TypeReference<List<UUID>> EMAIL_IDS = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public String writeContacts(List<Contact> contacts) {
    return write(contacts);
  }

  public List<Contact> readContacts(String json) {
    return read(json, CONTACTS);
  }

  public String writeEmailIds(List<UUID> emailIds) {
    return write(emailIds);
  }

  public List<UUID> readEmailIds(String json) {
    return read(json, EMAIL_IDS);
  }

  private String write(Object items) {
    try {
      return objectMapper.writeValueAsString(items);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize job items", ex);
    }
  }

  private <T> T read(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse job items", ex);
    }
  }
}
