/*
 * Where: Outreach service layer
 * What: gates every send against daily, hourly and recipient quotas and keeps the reputation
 * Why: quota tiers follow the owner's warm-up status and reputation score
 */
package com.example.outreach.service;

import com.example.outreach.config.GovernorProperties;
import com.example.outreach.model.LimitRule;
import com.example.outreach.model.LimitRuleType;
import com.example.outreach.model.LimitTier;
import com.example.outreach.model.QuotaRecord;
import com.example.outreach.model.ReputationRecord;
import com.example.outreach.model.SendDecision;
import com.example.outreach.model.SendLimits;
import com.example.outreach.model.WarmupStatus;
import com.example.outreach.repository.LimitRuleRepository;
import com.example.outreach.repository.QuotaRepository;
import com.example.outreach.repository.ReputationRepository;
import com.example.outreach.repository.SendLogRepository;
import com.example.outreach.repository.SendLogRepository.SendStats;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class SendingRateGovernor {

  private static final Logger logger = LoggerFactory.getLogger(SendingRateGovernor.class);
  static final double MAX_TIER_SCORE = 8.0d;

  private final LimitRuleRepository limitRuleRepository;
  private final QuotaRepository quotaRepository;
  private final SendLogRepository sendLogRepository;
  private final ReputationRepository reputationRepository;
  private final OwnerLockKeyGenerator lockKeyGenerator;
  private final GovernorProperties properties;
  private final Clock clock;

  public SendLimits computeLimits(String ownerId) {
    final ReputationRecord reputation = currentReputation(ownerId);
    final LimitTier tier = tierFor(reputation);
    final Map<LimitRuleType, LimitRule> rules = limitRuleRepository.findAll();
    final ZonedDateTime now = ZonedDateTime.now(clock);
    final LocalDate today = now.toLocalDate();
    final QuotaRecord quota =
        quotaRepository.find(ownerId, today).orElseGet(() -> QuotaRecord.empty(ownerId, today));
    final Instant hourStart = now.truncatedTo(ChronoUnit.HOURS).toInstant();
    final int sentThisHour = sendLogRepository.countSentSince(ownerId, hourStart);
    return new SendLimits(
        dailyLimit(rules, tier),
        limitFor(rules, LimitRuleType.HOURLY_LIMIT, tier),
        limitFor(rules, LimitRuleType.RECIPIENT_LIMIT, tier),
        limitFor(rules, LimitRuleType.BATCH_LIMIT, tier),
        quota.emailsSent(),
        sentThisHour,
        quota.uniqueRecipients(),
        reputation.score(),
        reputation.warmupStatus());
  }

  public SendDecision canSend(String ownerId, int recipientCount) {
    if (recipientCount <= 0) {
      throw new IllegalArgumentException("recipient_count must be positive");
    }
    final SendLimits limits = computeLimits(ownerId);
    if (limits.sentToday() + recipientCount > limits.dailyLimit()) {
      return SendDecision.deny(
          String.format(
              Locale.ROOT,
              "Daily limit reached. You have sent %d emails of %d allowed today.",
              limits.sentToday(),
              limits.dailyLimit()));
    }
    if (limits.sentThisHour() + recipientCount > limits.hourlyLimit()) {
      return SendDecision.deny(
          String.format(
              Locale.ROOT,
              "Hourly limit reached. You have sent %d emails of %d allowed this hour.",
              limits.sentThisHour(),
              limits.hourlyLimit()));
    }
    if (limits.uniqueToday() + recipientCount > limits.recipientLimit()) {
      return SendDecision.deny(
          String.format(
              Locale.ROOT,
              "Recipient limit reached. You have contacted %d unique recipients of %d allowed"
                  + " today.",
              limits.uniqueToday(),
              limits.recipientLimit()));
    }
    final int remainingAfter = limits.dailyLimit() - limits.sentToday() - recipientCount;
    final String reason =
        String.format(
            Locale.ROOT, "Sending allowed. %d emails remaining today.", remainingAfter);
    return SendDecision.allow(reason, sendWarning(limits, remainingAfter));
  }

  /** Warnings shown alongside the current limits. */
  public List<String> warnings(SendLimits limits) {
    final List<String> warnings = new ArrayList<>();
    if (limits.warmupStatus() == WarmupStatus.NEW) {
      warnings.add(warmupWarning(limits));
    }
    if (limits.remainingToday() <= properties.lowRemainingThreshold()) {
      warnings.add(lowRemainingWarning(limits.remainingToday()));
    }
    if (limits.reputationScore() < properties.lowReputationThreshold()) {
      warnings.add(
          String.format(
              Locale.ROOT,
              "Reputation score %.1f is low; review bounces before sending more.",
              limits.reputationScore()));
    }
    return warnings;
  }

  /**
   * Adds a successful dispatch to today's counters. Only addresses that have not been sent to
   * today raise the unique-recipient counter.
   */
  @Transactional
  public void recordSend(String ownerId, Collection<String> recipients, String messageId) {
    if (recipients.isEmpty()) {
      return;
    }
    quotaRepository.lockOwner(lockKeyGenerator.generate(ownerId));
    final ZonedDateTime now = ZonedDateTime.now(clock);
    final LocalDate today = now.toLocalDate();
    final Instant dayStart = today.atStartOfDay(clock.getZone()).toInstant();
    final Set<String> addresses = new LinkedHashSet<>();
    for (String recipient : recipients) {
      addresses.add(normalize(recipient));
    }
    final int alreadyCounted =
        sendLogRepository.countRecipientsSentSince(ownerId, addresses, dayStart);
    final int newUnique = Math.max(0, addresses.size() - alreadyCounted);
    quotaRepository.increment(ownerId, today, recipients.size(), newUnique, now.toInstant());
    for (String recipient : recipients) {
      sendLogRepository.insert(ownerId, normalize(recipient), now.toInstant(), messageId);
    }
  }

  @Transactional
  public boolean recordBounce(String ownerId, String recipientAddress, String reason) {
    final int updated =
        sendLogRepository.markLatestBounced(ownerId, normalize(recipientAddress), reason);
    if (updated == 0) {
      logger.info("bounce ignored; no delivered message ownerId={}", ownerId);
      return false;
    }
    return true;
  }

  @Transactional
  public ReputationRecord recalculateReputation(String ownerId) {
    final ReputationRecord current = currentReputation(ownerId);
    final ZonedDateTime now = ZonedDateTime.now(clock);
    final LocalDate today = now.toLocalDate();
    final int windowDays = properties.reputationWindowDays();
    final int activeDays =
        quotaRepository.countActiveDays(ownerId, today.minusDays(windowDays - 1L), today);
    final SendStats stats =
        sendLogRepository.statsSince(ownerId, now.minusDays(windowDays).toInstant());
    final double score = ReputationCalculator.score(activeDays, stats.totalSent(), stats.bounced());
    final WarmupStatus warmupStatus =
        ReputationCalculator.nextWarmupStatus(
            current.warmupStatus(), activeDays, stats.totalSent());
    final ReputationRecord updated =
        new ReputationRecord(
            ownerId,
            score,
            stats.totalSent(),
            stats.bounced(),
            current.totalSpamReports(),
            stats.totalSent() - stats.bounced(),
            warmupStatus,
            now.toInstant());
    reputationRepository.upsert(updated);
    if (warmupStatus != current.warmupStatus()) {
      logger.info(
          "warmup status changed ownerId={} from={} to={}",
          ownerId,
          current.warmupStatus().value(),
          warmupStatus.value());
    }
    return updated;
  }

  /** Explicit external action; the only way into {@code new} or {@code restricted}. */
  public void setWarmupStatus(String ownerId, WarmupStatus status) {
    reputationRepository.upsertWarmupStatus(ownerId, status, ReputationRecord.INITIAL_SCORE);
    logger.info("warmup status set ownerId={} status={}", ownerId, status.value());
  }

  /** Owners that sent anything inside the reputation window. */
  public List<String> ownersInWindow() {
    final LocalDate today = LocalDate.now(clock);
    return quotaRepository.findOwnersActiveSince(
        today.minusDays(properties.reputationWindowDays() - 1L));
  }

  public ReputationRecord currentReputation(String ownerId) {
    return reputationRepository.find(ownerId).orElseGet(() -> ReputationRecord.initial(ownerId));
  }

  @VisibleForTesting
  static LimitTier tierFor(ReputationRecord reputation) {
    if (reputation.warmupStatus() == WarmupStatus.NEW) {
      return LimitTier.WARMUP;
    }
    if (reputation.score() >= MAX_TIER_SCORE) {
      return LimitTier.MAX;
    }
    return LimitTier.DEFAULT;
  }

  private int dailyLimit(Map<LimitRuleType, LimitRule> rules, LimitTier tier) {
    final Integer override = properties.warmupDailyLimitOverride();
    if (tier == LimitTier.WARMUP && override != null) {
      return override;
    }
    return limitFor(rules, LimitRuleType.DAILY_LIMIT, tier);
  }

  private int limitFor(Map<LimitRuleType, LimitRule> rules, LimitRuleType type, LimitTier tier) {
    final LimitRule rule = rules.get(type);
    if (rule == null) {
      throw new IllegalStateException("limit rule missing: " + type.value());
    }
    return rule.valueFor(tier);
  }

  private String sendWarning(SendLimits limits, int remainingAfter) {
    final List<String> warnings = new ArrayList<>();
    if (limits.warmupStatus() == WarmupStatus.NEW) {
      warnings.add(warmupWarning(limits));
    }
    if (remainingAfter <= properties.lowRemainingThreshold()) {
      warnings.add(lowRemainingWarning(remainingAfter));
    }
    return warnings.isEmpty() ? null : String.join(" ", warnings);
  }

  private String warmupWarning(SendLimits limits) {
    return String.format(
        Locale.ROOT,
        "Your sending identity is warming up; the daily limit is %d emails.",
        limits.dailyLimit());
  }

  private String lowRemainingWarning(int remaining) {
    return String.format(Locale.ROOT, "Only %d emails remaining today.", remaining);
  }

  static String normalize(String address) {
    return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
  }
}
