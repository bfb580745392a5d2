package io.echomail.backend.bounce;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the bounce history and the suppression list. An address is suppressed after one hard
 * bounce, one complaint, or {@code softBounceThreshold} soft bounces inside the rolling window.
 * Suppression only ever grows from bounces; {@link #unsuppress} is the one way back.
 */
@Service
public class SuppressionService {

  private static final Logger log = LoggerFactory.getLogger(SuppressionService.class);

  static final String IMPORTED_REASON = "Imported suppression list";
  static final String LISTED_REASON = "On suppression list";

  private final BounceRecordRepository bounceRecordRepository;
  private final SuppressedAddressRepository suppressedAddressRepository;
  private final Clock clock;
  private final int softBounceThreshold;
  private final Duration softBounceWindow;
  private final Cache<String, Boolean> suppressionCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofSeconds(60)).build();

  public SuppressionService(
      BounceRecordRepository bounceRecordRepository,
      SuppressedAddressRepository suppressedAddressRepository,
      Clock clock,
      @Value("${echomail.bounces.soft-bounce-threshold:3}") int softBounceThreshold,
      @Value("${echomail.bounces.soft-bounce-window:7d}") Duration softBounceWindow) {
    this.bounceRecordRepository = bounceRecordRepository;
    this.suppressedAddressRepository = suppressedAddressRepository;
    this.clock = clock;
    this.softBounceThreshold = softBounceThreshold;
    this.softBounceWindow = softBounceWindow;
  }

  /** Stores the bounce and suppresses its address if the history now warrants it. */
  @Transactional
  public EmailHealthStatus recordAndEvaluate(BounceRecord record) {
    bounceRecordRepository.save(record);
    log.warn(
        "Bounce recorded: address={}, type={}, category={}",
        record.getAddress(),
        record.getType(),
        record.getCategory());

    EmailHealthStatus health = healthOf(record.getAddress());
    if (health.shouldSuppress() && !suppressedAddressRepository.existsById(record.getAddress())) {
      suppressedAddressRepository.save(
          new SuppressedAddress(record.getAddress(), health.suppressionReason(), clock.instant()));
      suppressionCache.put(record.getAddress(), Boolean.TRUE);
      log.info("Suppressed {}: {}", record.getAddress(), health.suppressionReason());
    }
    return health;
  }

  @Transactional(readOnly = true)
  public EmailHealthStatus healthOf(String address) {
    String normalized = BounceClassifier.normalize(address);
    List<BounceRecord> records =
        bounceRecordRepository.findByAddressOrderByRecordedAtAsc(normalized);
    boolean listed = suppressedAddressRepository.existsById(normalized);
    if (records.isEmpty()) {
      return listed
          ? new EmailHealthStatus(normalized, true, 0, null, null, true, LISTED_REASON)
          : EmailHealthStatus.clean(normalized);
    }

    BounceRecord latest = records.get(records.size() - 1);
    BounceRecord firstHard = null;
    boolean complained = false;
    int recentSoft = 0;
    Instant windowStart = clock.instant().minus(softBounceWindow);
    for (BounceRecord record : records) {
      switch (record.getType()) {
        case HARD -> firstHard = firstHard == null ? record : firstHard;
        case COMPLAINT -> complained = true;
        case SOFT -> {
          if (!record.getRecordedAt().isBefore(windowStart)) {
            recentSoft++;
          }
        }
        case UNSUBSCRIBE -> {
          // recorded for stats only; does not suppress
        }
      }
    }

    boolean valid = firstHard == null;
    String reason = null;
    if (firstHard != null) {
      reason = "Hard bounce detected: " + firstHard.getReason();
    } else if (complained) {
      reason = "Spam complaint received";
    } else if (recentSoft >= softBounceThreshold) {
      reason = recentSoft + " soft bounces in " + softBounceWindow.toDays() + " days";
    } else if (listed) {
      reason = LISTED_REASON;
    }
    return new EmailHealthStatus(
        normalized,
        valid,
        records.size(),
        latest.getType(),
        latest.getRecordedAt(),
        reason != null,
        reason);
  }

  public boolean isSuppressed(String address) {
    String normalized = BounceClassifier.normalize(address);
    return suppressionCache.get(normalized, suppressedAddressRepository::existsById);
  }

  /** Splits {@code addresses} into eligible and suppressed, keeping input order and spelling. */
  @Transactional(readOnly = true)
  public EligibilityResult filterEligible(Collection<String> addresses) {
    Set<String> normalized = new HashSet<>();
    for (String address : addresses) {
      if (address != null && !address.isBlank()) {
        normalized.add(BounceClassifier.normalize(address));
      }
    }
    Set<String> suppressedSet = new HashSet<>();
    if (!normalized.isEmpty()) {
      for (SuppressedAddress entry : suppressedAddressRepository.findByAddressIn(normalized)) {
        suppressedSet.add(entry.getAddress());
      }
    }

    List<String> eligible = new ArrayList<>();
    List<String> suppressed = new ArrayList<>();
    for (String address : addresses) {
      if (address != null
          && !address.isBlank()
          && suppressedSet.contains(BounceClassifier.normalize(address))) {
        suppressed.add(address);
      } else {
        eligible.add(address);
      }
    }
    if (!suppressed.isEmpty()) {
      log.info("Filtered {} suppressed address(es) from {}", suppressed.size(), addresses.size());
    }
    return new EligibilityResult(eligible, suppressed);
  }

  /** Removes an address from the suppression list. Returns false if it was not listed. */
  @Transactional
  public boolean unsuppress(String address) {
    String normalized = BounceClassifier.normalize(address);
    if (!suppressedAddressRepository.existsById(normalized)) {
      return false;
    }
    suppressedAddressRepository.deleteById(normalized);
    suppressionCache.invalidate(normalized);
    log.info("Address unsuppressed: {}", normalized);
    return true;
  }

  /** Adds addresses to the suppression list and returns how many were newly added. */
  @Transactional
  public int importSuppressions(Collection<String> addresses) {
    Instant now = clock.instant();
    Set<String> seen = new HashSet<>();
    int imported = 0;
    for (String address : addresses) {
      if (address == null || address.isBlank()) {
        continue;
      }
      String normalized = BounceClassifier.normalize(address);
      if (seen.add(normalized) && !suppressedAddressRepository.existsById(normalized)) {
        suppressedAddressRepository.save(new SuppressedAddress(normalized, IMPORTED_REASON, now));
        suppressionCache.put(normalized, Boolean.TRUE);
        imported++;
      }
    }
    log.info("Imported {} suppressed address(es)", imported);
    return imported;
  }

  @Transactional(readOnly = true)
  public List<SuppressedAddress> listSuppressions() {
    return suppressedAddressRepository.findAllByOrderBySuppressedAtAsc();
  }

  @Transactional(readOnly = true)
  public List<String> exportSuppressions() {
    return listSuppressions().stream().map(SuppressedAddress::getAddress).toList();
  }

  @Transactional(readOnly = true)
  public BounceStats stats(String campaignId) {
    List<Object[]> rows =
        campaignId == null
            ? bounceRecordRepository.countByType()
            : bounceRecordRepository.countByTypeForCampaign(campaignId);
    long hard = 0;
    long soft = 0;
    long complaints = 0;
    long unsubscribes = 0;
    for (Object[] row : rows) {
      long count = ((Number) row[1]).longValue();
      switch ((BounceType) row[0]) {
        case HARD -> hard = count;
        case SOFT -> soft = count;
        case COMPLAINT -> complaints = count;
        case UNSUBSCRIBE -> unsubscribes = count;
      }
    }
    return new BounceStats(
        hard + soft + complaints + unsubscribes,
        hard,
        soft,
        complaints,
        unsubscribes,
        0.0,
        suppressedAddressRepository.count());
  }

  /** Bounces as a percentage of {@code totalSent}; zero when nothing was sent. */
  @Transactional(readOnly = true)
  public double bounceRate(long totalSent, String campaignId) {
    if (totalSent <= 0) {
      return 0.0;
    }
    return stats(campaignId).total() * 100.0 / totalSent;
  }
}
