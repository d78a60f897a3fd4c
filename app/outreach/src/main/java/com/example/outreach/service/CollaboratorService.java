package com.example.outreach.service;

import com.example.outreach.repository.CollaboratorRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Symmetric collaborator links used when deduplicating across owners. */
@Service
@RequiredArgsConstructor
public class CollaboratorService {

  private static final Logger logger = LoggerFactory.getLogger(CollaboratorService.class);

  private final CollaboratorRepository collaboratorRepository;
  private final Clock clock;

  public List<String> list(String ownerId) {
    return collaboratorRepository.findCollaborators(ownerId);
  }

  public boolean add(String ownerId, String collaboratorId) {
    validate(ownerId, collaboratorId);
    final boolean created =
        collaboratorRepository.insertIfAbsent(ownerId, collaboratorId, Instant.now(clock)) > 0;
    if (created) {
      logger.info("collaborator linked collaboratorId={}", collaboratorId);
    }
    return created;
  }

  public boolean remove(String ownerId, String collaboratorId) {
    validate(ownerId, collaboratorId);
    return collaboratorRepository.delete(ownerId, collaboratorId) > 0;
  }

  private void validate(String ownerId, String collaboratorId) {
    if (collaboratorId == null || collaboratorId.isBlank()) {
      throw new IllegalArgumentException("collaborator id is required");
    }
    if (ownerId.equals(collaboratorId)) {
      throw new IllegalArgumentException("an owner cannot collaborate with themselves");
    }
  }
}
