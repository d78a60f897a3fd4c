/*
 * Where: Outreach API
 * What: machine-readable error codes
 * Why: clients tell a quota denial from a delivery failure without parsing messages
 */
package com.example.outreach.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  PRECONDITION_FAILED,
  JOB_NOT_FOUND,
  EMAIL_NOT_FOUND,
  TEMPLATE_NOT_FOUND,
  JOB_STATE_CONFLICT,
  EMAIL_STATE_CONFLICT,
  TEMPLATE_LIMIT_EXCEEDED,
  QUOTA_DENIED,
  DELIVERY_FAILED,
  DELIVERY_TOKEN_INVALID
}
