/*
 * Where: Outreach API
 * What: quota position, pre-send checks, bounces and warm-up administration
 * Why: clients show remaining capacity before they start a send job
 */
package com.example.outreach.api;

import com.example.outreach.api.request.BounceRequest;
import com.example.outreach.api.request.SendCheckRequest;
import com.example.outreach.api.request.WarmupStatusRequest;
import com.example.outreach.api.response.BounceResponse;
import com.example.outreach.api.response.LimitsResponse;
import com.example.outreach.api.response.ReputationResponse;
import com.example.outreach.api.response.SendCheckResponse;
import com.example.outreach.config.RequestMdcInterceptor;
import com.example.outreach.model.SendLimits;
import com.example.outreach.model.WarmupStatus;
import com.example.outreach.service.SendingRateGovernor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/limits")
@RequiredArgsConstructor
public class LimitsController {

  private static final String HEADER_USER_ID = RequestMdcInterceptor.HEADER_USER_ID;

  private final SendingRateGovernor governor;

  @GetMapping
  public LimitsResponse limits(@RequestHeader(HEADER_USER_ID) String ownerId) {
    final SendLimits limits = governor.computeLimits(ownerId);
    return LimitsResponse.from(limits, governor.warnings(limits));
  }

  @PostMapping("/check")
  public SendCheckResponse check(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @Valid @RequestBody SendCheckRequest request) {
    return SendCheckResponse.from(governor.canSend(ownerId, request.recipientCount()));
  }

  @PostMapping("/bounces")
  public BounceResponse bounce(
      @RequestHeader(HEADER_USER_ID) String ownerId, @Valid @RequestBody BounceRequest request) {
    final boolean recorded =
        governor.recordBounce(ownerId, request.recipientAddress(), request.reason());
    return new BounceResponse(request.recipientAddress(), recorded);
  }

  @PutMapping("/warmup-status")
  public ReputationResponse warmupStatus(
      @RequestHeader(HEADER_USER_ID) String ownerId,
      @Valid @RequestBody WarmupStatusRequest request) {
    governor.setWarmupStatus(ownerId, WarmupStatus.fromValue(request.warmupStatus()));
    return ReputationResponse.from(governor.currentReputation(ownerId));
  }

  @PostMapping("/reputation/recalculate")
  public ReputationResponse recalculate(@RequestHeader(HEADER_USER_ID) String ownerId) {
    return ReputationResponse.from(governor.recalculateReputation(ownerId));
  }
}
