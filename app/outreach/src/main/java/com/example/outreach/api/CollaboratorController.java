package com.example.outreach.api;

import com.example.outreach.api.response.CollaboratorsResponse;
import com.example.outreach.config.RequestMdcInterceptor;
import com.example.outreach.service.CollaboratorService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/collaborators")
@RequiredArgsConstructor
public class CollaboratorController {

  private static final String HEADER_USER_ID = RequestMdcInterceptor.HEADER_USER_ID;

  private final CollaboratorService collaboratorService;

  @GetMapping
  public CollaboratorsResponse list(@RequestHeader(HEADER_USER_ID) String ownerId) {
    return new CollaboratorsResponse(ownerId, collaboratorService.list(ownerId));
  }

  @PostMapping("/{collaboratorId}")
  public CollaboratorsResponse add(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @PathVariable("collaboratorId") String collaboratorId) {
    collaboratorService.add(ownerId, collaboratorId);
    return new CollaboratorsResponse(ownerId, collaboratorService.list(ownerId));
  }

  @DeleteMapping("/{collaboratorId}")
  public ResponseEntity<Void> remove(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @PathVariable("collaboratorId") String collaboratorId) {
    collaboratorService.remove(ownerId, collaboratorId);
    return ResponseEntity.noContent().build();
  }
}
