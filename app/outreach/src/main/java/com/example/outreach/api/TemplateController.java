package com.example.outreach.api;

import com.example.outreach.api.request.TemplateRequest;
import com.example.outreach.api.response.TemplateResponse;
import com.example.outreach.api.response.TemplatesResponse;
import com.example.outreach.config.RequestMdcInterceptor;
import com.example.outreach.model.EmailStage;
import com.example.outreach.service.TemplateService;
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
@RequestMapping("/v1/templates")
@RequiredArgsConstructor
public class TemplateController {

  private static final String HEADER_USER_ID = RequestMdcInterceptor.HEADER_USER_ID;

  private final TemplateService templateService;

  @PostMapping
  public ResponseEntity<TemplateResponse> create(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @Valid @RequestBody TemplateRequest request) {
    final TemplateResponse response =
        TemplateResponse.from(
            templateService.create(
                ownerId,
                request.name(),
                EmailStage.fromValue(request.category()),
                request.subject(),
                request.body(),
                request.makeDefault()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping
  public TemplatesResponse list(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @RequestParam(value = "category", required = false) String category) {
    final EmailStage filter = category == null ? null : EmailStage.fromValue(category);
    return new TemplatesResponse(
        templateService.list(ownerId, filter).stream().map(TemplateResponse::from).toList());
  }

  @PutMapping("/{templateId}/default")
  public TemplateResponse markDefault(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @PathVariable("templateId") UUID templateId) {
    return TemplateResponse.from(templateService.markDefault(ownerId, templateId));
  }

  @DeleteMapping("/{templateId}")
  public ResponseEntity<Void> delete(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @PathVariable("templateId") UUID templateId) {
    templateService.delete(ownerId, templateId);
    return ResponseEntity.noContent().build();
  }
}
