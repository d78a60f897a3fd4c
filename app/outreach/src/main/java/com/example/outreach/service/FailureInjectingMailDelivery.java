/*
 * Where: Outreach delivery boundary
 * What: CI/test transport that fails for configured recipients or owners
 * Why: exercise per-item delivery failures and the credential warning end to end
 */
package com.example.outreach.service;

import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "outreach.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingMailDelivery implements MailDelivery {

  private final LocalMailDelivery delegate;

  @Value("${outreach.delivery.failure-injection.recipient-domain:}")
  private String failingRecipientDomain;

  @Value("${outreach.delivery.failure-injection.token-invalid-owner-prefix:}")
  private String tokenInvalidOwnerPrefix;

  @Override
  public String deliver(String ownerId, String to, String subject, String body) {
    if (matchesPrefix(ownerId, tokenInvalidOwnerPrefix)) {
      throw new DeliveryException(
          DeliveryException.Kind.TOKEN_INVALID,
          "delivery credential rejected for ownerId=" + ownerId);
    }
    if (matchesDomain(to)) {
      throw new DeliveryException(
          DeliveryException.Kind.FAILURE, "delivery failure injection matched recipient domain");
    }
    return delegate.deliver(ownerId, to, subject, body);
  }

  private boolean matchesPrefix(String ownerId, String prefix) {
    return prefix != null && !prefix.isBlank() && ownerId.startsWith(prefix);
  }

  private boolean matchesDomain(String to) {
    if (failingRecipientDomain == null || failingRecipientDomain.isBlank()) {
      return false;
    }
    final String suffix = "@" + failingRecipientDomain.toLowerCase(Locale.ROOT);
    return to.toLowerCase(Locale.ROOT).endsWith(suffix);
  }
}
