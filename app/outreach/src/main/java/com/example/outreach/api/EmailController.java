package com.example.outreach.api;

import com.example.outreach.api.request.EmailStatusRequest;
import com.example.outreach.api.response.CompletionsResponse;
import com.example.outreach.api.response.EmailResponse;
import com.example.outreach.api.response.EmailsResponse;
import com.example.outreach.api.response.SendEmailResponse;
import com.example.outreach.config.RequestMdcInterceptor;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailStatus;
import com.example.outreach.service.EmailService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class EmailController {

  private static final String HEADER_USER_ID = RequestMdcInterceptor.HEADER_USER_ID;

  private final EmailService emailService;

  @GetMapping("/emails")
  public EmailsResponse list(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @RequestParam(value = "stage", required = false) String stage,
      @RequestParam(value = "group_id", required = false) UUID groupId) {
    final EmailStage stageFilter = stage == null ? null : EmailStage.fromValue(stage);
    return new EmailsResponse(
        emailService.list(ownerId, stageFilter, groupId).stream()
            .map(EmailResponse::from)
            .toList());
  }

  @PutMapping("/emails/{emailId}/status")
  public EmailResponse updateStatus(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @PathVariable("emailId") UUID emailId,
      @Valid @RequestBody EmailStatusRequest request) {
    return EmailResponse.from(
        emailService.updateStatus(ownerId, emailId, EmailStatus.fromValue(request.status())));
  }

  @DeleteMapping("/emails/{emailId}")
  public ResponseEntity<Void> delete(
      @RequestHeader(HEADER_USER_ID) String ownerId, @PathVariable("emailId") UUID emailId) {
    emailService.delete(ownerId, emailId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/emails/{emailId}/send")
  public SendEmailResponse send(
      @RequestHeader(HEADER_USER_ID) String ownerId, @PathVariable("emailId") UUID emailId) {
    return SendEmailResponse.from(emailId, emailService.send(ownerId, emailId));
  }

  @PostMapping("/emails/{emailId}/next-stage")
  public ResponseEntity<EmailResponse> regenerateNextStage(
      @RequestHeader(HEADER_USER_ID) String ownerId, @PathVariable("emailId") UUID emailId) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(EmailResponse.from(emailService.regenerateNextStage(ownerId, emailId)));
  }

  @GetMapping("/completions")
  public CompletionsResponse completions(@RequestHeader(HEADER_USER_ID) String ownerId) {
    return CompletionsResponse.from(emailService.completions(ownerId));
  }
}
