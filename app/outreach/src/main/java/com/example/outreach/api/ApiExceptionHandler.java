/*
 * Where: Outreach API
 * What: maps domain exceptions to HTTP responses
 * Why: every endpoint reports failures in the same code/message shape
 */
package com.example.outreach.api;

import com.example.outreach.service.DeliveryException;
import com.example.outreach.service.QuotaDeniedException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(PreconditionFailedException.class)
  public ResponseEntity<ApiErrorResponse> handlePreconditionFailed(PreconditionFailedException ex) {
    return respond(HttpStatus.PRECONDITION_FAILED, ApiErrorCode.PRECONDITION_FAILED, ex);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleJobNotFound(JobNotFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, ApiErrorCode.JOB_NOT_FOUND, ex);
  }

  @ExceptionHandler(EmailNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleEmailNotFound(EmailNotFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, ApiErrorCode.EMAIL_NOT_FOUND, ex);
  }

  @ExceptionHandler(TemplateNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTemplateNotFound(TemplateNotFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, ApiErrorCode.TEMPLATE_NOT_FOUND, ex);
  }

  @ExceptionHandler(InvalidJobStateException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidJobState(InvalidJobStateException ex) {
    return respond(HttpStatus.CONFLICT, ApiErrorCode.JOB_STATE_CONFLICT, ex);
  }

  @ExceptionHandler(InvalidEmailStateException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidEmailState(InvalidEmailStateException ex) {
    return respond(HttpStatus.CONFLICT, ApiErrorCode.EMAIL_STATE_CONFLICT, ex);
  }

  @ExceptionHandler(TemplateLimitExceededException.class)
  public ResponseEntity<ApiErrorResponse> handleTemplateLimit(TemplateLimitExceededException ex) {
    return respond(HttpStatus.CONFLICT, ApiErrorCode.TEMPLATE_LIMIT_EXCEEDED, ex);
  }

  @ExceptionHandler(QuotaDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleQuotaDenied(QuotaDeniedException ex) {
    return respond(HttpStatus.TOO_MANY_REQUESTS, ApiErrorCode.QUOTA_DENIED, ex);
  }

  @ExceptionHandler(DeliveryException.class)
  public ResponseEntity<ApiErrorResponse> handleDelivery(DeliveryException ex) {
    final ApiErrorCode code =
        ex.isTokenInvalid() ? ApiErrorCode.DELIVERY_TOKEN_INVALID : ApiErrorCode.DELIVERY_FAILED;
    return respond(HttpStatus.BAD_GATEWAY, code, ex);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
    return badRequest(ex.getRequestPartName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> respond(
      HttpStatus status, ApiErrorCode code, RuntimeException ex) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
