/*
 * Where: Outreach API
 * What: starts generation and send jobs and exposes their progress and controls
 * Why: batch work runs in the background; callers poll or subscribe for progress
 */
package com.example.outreach.api;

import com.example.outreach.api.request.ContactPayload;
import com.example.outreach.api.request.GenerateJobRequest;
import com.example.outreach.api.request.SendJobRequest;
import com.example.outreach.api.response.JobResponse;
import com.example.outreach.config.RequestMdcInterceptor;
import com.example.outreach.model.Contact;
import com.example.outreach.model.DedupeOptions;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.JobRecord;
import com.example.outreach.service.BatchJobService;
import com.example.outreach.service.ContactCsvParser;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/v1/jobs")
@RequiredArgsConstructor
public class JobController {

  private static final String HEADER_USER_ID = RequestMdcInterceptor.HEADER_USER_ID;

  private final BatchJobService batchJobService;
  private final ContactCsvParser csvParser;

  @PostMapping("/generate")
  public ResponseEntity<JobResponse> generate(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @Valid @RequestBody GenerateJobRequest request) {
    final List<Contact> contacts =
        request.contacts().stream().map(ContactPayload::toContact).toList();
    final JobRecord job =
        batchJobService.startGenerationJob(
            ownerId,
            contacts,
            request.templateId(),
            EmailStage.fromValue(request.stage()),
            new DedupeOptions(request.avoidDuplicates(), request.includeCollaborators()));
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(job));
  }

  @PostMapping(value = "/generate/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<JobResponse> generateFromCsv(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @RequestPart("file") MultipartFile file,
      @RequestParam(value = "stage", defaultValue = "outreach") String stage,
      @RequestParam(value = "template_id", required = false) UUID templateId,
      @RequestParam(value = "avoid_duplicates", defaultValue = "false") boolean avoidDuplicates,
      @RequestParam(value = "include_collaborators", defaultValue = "false")
          boolean includeCollaborators)
      throws IOException {
    final List<Contact> contacts;
    try (InputStream input = file.getInputStream()) {
      contacts = csvParser.parse(input);
    }
    final JobRecord job =
        batchJobService.startGenerationJob(
            ownerId,
            contacts,
            templateId,
            EmailStage.fromValue(stage),
            new DedupeOptions(avoidDuplicates, includeCollaborators));
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(job));
  }

  @PostMapping("/send")
  public ResponseEntity<JobResponse> send(
      @RequestHeader(HEADER_USER_ID) String ownerId, @Valid @RequestBody SendJobRequest request) {
    final JobRecord job =
        batchJobService.startSendJob(
            ownerId, EmailStage.fromValue(request.stage()), request.groupId(), request.emailIds());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(job));
  }

  @GetMapping("/{jobId}")
  public JobResponse get(
      @RequestHeader(HEADER_USER_ID) String ownerId, @PathVariable("jobId") UUID jobId) {
    return JobResponse.from(batchJobService.getJob(ownerId, jobId));
  }

  @PostMapping("/{jobId}/pause")
  public JobResponse pause(
      @RequestHeader(HEADER_USER_ID) String ownerId, @PathVariable("jobId") UUID jobId) {
    return JobResponse.from(batchJobService.pause(ownerId, jobId));
  }

  @PostMapping("/{jobId}/resume")
  public JobResponse resume(
      @RequestHeader(HEADER_USER_ID) String ownerId, @PathVariable("jobId") UUID jobId) {
    return JobResponse.from(batchJobService.resume(ownerId, jobId));
  }

  @PostMapping("/{jobId}/cancel")
  public JobResponse cancel(
      @RequestHeader(HEADER_USER_ID) String ownerId, @PathVariable("jobId") UUID jobId) {
    return JobResponse.from(batchJobService.cancel(ownerId, jobId));
  }
}
