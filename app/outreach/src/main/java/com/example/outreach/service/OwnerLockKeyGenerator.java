/*
 * Where: Outreach service helper
 * What: derives a 64-bit advisory lock key from an owner id
 * Why: hashtext is 32-bit and would serialize unrelated owners on collision
 */
package com.example.outreach.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class OwnerLockKeyGenerator {

  static final int LOCK_KEY_BYTES = 8;
  private static final String NAMESPACE = "outreach-quota:";

  public long generate(String ownerId) {
    if (ownerId == null || ownerId.isBlank()) {
      throw new IllegalArgumentException("ownerId is required");
    }
    // First 8 bytes of SHA-256, big endian.
    final byte[] hashed = sha256(NAMESPACE + ownerId);
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] sha256(String value) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
