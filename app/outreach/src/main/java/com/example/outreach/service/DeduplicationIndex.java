/*
 * Where: Outreach service layer
 * What: builds the set of addresses an owner (and sharing collaborators) already contacted
 * Why: filter a new batch before paying for content generation
 */
package com.example.outreach.service;

import com.example.outreach.repository.CollaboratorRepository;
import com.example.outreach.repository.CompletionRepository;
import com.example.outreach.repository.EmailRepository;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeduplicationIndex {

  private static final Logger logger = LoggerFactory.getLogger(DeduplicationIndex.class);

  private final EmailRepository emailRepository;
  private final CompletionRepository completionRepository;
  private final CollaboratorRepository collaboratorRepository;

  /**
   * Returns a mutable set of lower-cased addresses. Callers add to it while a batch runs so that
   * later rows of the same batch are filtered too.
   */
  public Set<String> buildAlreadyContacted(String ownerId, boolean includeCollaborators) {
    final Set<String> contacted = new HashSet<>();
    addOwner(contacted, ownerId);
    if (includeCollaborators) {
      for (String collaboratorId : collaboratorRepository.findSharingCollaborators(ownerId)) {
        addOwner(contacted, collaboratorId);
      }
    }
    logger.debug(
        "dedup index built ownerId={} includeCollaborators={} size={}",
        ownerId,
        includeCollaborators,
        contacted.size());
    return contacted;
  }

  public static String normalize(String address) {
    return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
  }

  private void addOwner(Set<String> contacted, String ownerId) {
    addAll(contacted, emailRepository.findRecipientAddresses(ownerId));
    addAll(contacted, completionRepository.findRecipientAddresses(ownerId));
  }

  private void addAll(Set<String> contacted, Collection<String> addresses) {
    for (String address : addresses) {
      if (address != null && !address.isBlank()) {
        contacted.add(normalize(address));
      }
    }
  }
}
