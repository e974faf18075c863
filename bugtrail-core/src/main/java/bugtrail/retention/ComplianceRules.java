package bugtrail.retention;

import bugtrail.model.ComplianceRegion;
import bugtrail.model.DataClassification;
import bugtrail.model.RetentionPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Regional retention minimums and tier limits.
 *
 * <p>Minimums are in days per region and data classification. A pair missing from the
 * table has no regional minimum.
 */
public final class ComplianceRules {
  public static final int DEFAULT_RETENTION_DAYS = 90;
  public static final int SCREENSHOT_RETENTION_DAYS = 60;
  public static final int REPLAY_RETENTION_DAYS = 30;
  public static final int ATTACHMENT_RETENTION_DAYS = 90;
  public static final int ARCHIVED_RETENTION_DAYS = 365;

  private static final Map<ComplianceRegion, Map<DataClassification, Integer>> MIN_RETENTION =
      new EnumMap<>(ComplianceRegion.class);

  private static final Set<ComplianceRegion> TRUE_DELETION_REGIONS =
      Collections.unmodifiableSet(EnumSet.of(ComplianceRegion.KZ, ComplianceRegion.EU));

  private static final Set<ComplianceRegion> CERTIFICATE_REGIONS =
      Collections.unmodifiableSet(EnumSet.of(ComplianceRegion.KZ, ComplianceRegion.EU, ComplianceRegion.US));

  static {
    // GDPR sets maximums rather than minimums; financial records still need a year.
    minimum(ComplianceRegion.EU, DataClassification.FINANCIAL, 365);

    minimum(ComplianceRegion.US, DataClassification.FINANCIAL, 2555);
    minimum(ComplianceRegion.US, DataClassification.HEALTHCARE, 2555);
    minimum(ComplianceRegion.US, DataClassification.GOVERNMENT, 1095);

    minimum(ComplianceRegion.KZ, DataClassification.GENERAL, 90);
    minimum(ComplianceRegion.KZ, DataClassification.FINANCIAL, 1825);
    minimum(ComplianceRegion.KZ, DataClassification.GOVERNMENT, 1825);
    minimum(ComplianceRegion.KZ, DataClassification.HEALTHCARE, 3650);

    minimum(ComplianceRegion.UK, DataClassification.FINANCIAL, 2190);
    minimum(ComplianceRegion.UK, DataClassification.HEALTHCARE, 2920);

    minimum(ComplianceRegion.CA, DataClassification.FINANCIAL, 2190);
    minimum(ComplianceRegion.CA, DataClassification.HEALTHCARE, 3650);
  }

  private ComplianceRules() {}

  private static void minimum(ComplianceRegion region, DataClassification classification, int days) {
    MIN_RETENTION.computeIfAbsent(region, r -> new EnumMap<>(DataClassification.class))
        .put(classification, days);
  }

  /**
   * Regional minimum in days, or {@code 0} when the region sets none for the classification.
   */
  public static int minRetentionDays(ComplianceRegion region, DataClassification classification) {
    if (region == null || classification == null) {
      return 0;
    }
    Map<DataClassification, Integer> byClass = MIN_RETENTION.get(region);
    if (byClass == null) {
      return 0;
    }
    return byClass.getOrDefault(classification, 0);
  }

  /**
   * True when deleted data must be removed physically rather than kept as an archive.
   */
  public static boolean requiresTrueDeletion(ComplianceRegion region) {
    return region != null && TRUE_DELETION_REGIONS.contains(region);
  }

  /**
   * True when every hard delete must produce a {@link DeletionCertificate}.
   */
  public static boolean requiresCertificate(ComplianceRegion region) {
    return region != null && CERTIFICATE_REGIONS.contains(region);
  }

  /**
   * Default policy: 90 days for reports, 60 for screenshots, 30 for replays, 90 for
   * attachments, 365 for archives, archive before delete.
   */
  public static RetentionPolicy defaultPolicy() {
    return new RetentionPolicy(DEFAULT_RETENTION_DAYS, SCREENSHOT_RETENTION_DAYS, REPLAY_RETENTION_DAYS,
        ATTACHMENT_RETENTION_DAYS, ARCHIVED_RETENTION_DAYS, true,
        DataClassification.GENERAL, ComplianceRegion.NONE);
  }

  /**
   * Default policy adjusted to a tier and compliance context.
   *
   * <p>The free tier caps every window at its maximum; then every window is raised to the
   * larger of the tier minimum and the regional minimum. The archived window is unchanged.
   */
  public static RetentionPolicy policyForTier(RetentionTier tier, DataClassification classification,
      ComplianceRegion region) {
    RetentionPolicy base = defaultPolicy();
    int minDays = Math.max(tier.minDays(), minRetentionDays(region, classification));
    int cap = tier == RetentionTier.FREE && !tier.isUnlimited() ? tier.maxDays() : Integer.MAX_VALUE;
    return new RetentionPolicy(
        Math.max(minDays, Math.min(cap, base.bugReportRetentionDays())),
        Math.max(minDays, Math.min(cap, base.screenshotRetentionDays())),
        Math.max(minDays, Math.min(cap, base.replayRetentionDays())),
        Math.max(minDays, Math.min(cap, base.attachmentRetentionDays())),
        base.archivedRetentionDays(),
        base.archiveBeforeDelete(),
        classification,
        region);
  }

  /**
   * Checks a report retention window against tier and regional limits.
   *
   * @return an error message, or {@code null} when the value is allowed
   */
  public static String validateRetentionDays(int days, RetentionTier tier,
      DataClassification classification, ComplianceRegion region) {
    int complianceMin = minRetentionDays(region, classification);
    int minDays = Math.max(tier.minDays(), complianceMin);
    if (days < minDays) {
      List<String> reasons = new ArrayList<>();
      if (tier.minDays() == minDays) {
        reasons.add("tier minimum: " + tier.minDays() + " days");
      }
      if (complianceMin == minDays && complianceMin > 0) {
        reasons.add(region.value().toUpperCase(Locale.ROOT) + " compliance: " + complianceMin + " days");
      }
      return "Retention period must be at least " + minDays + " days (" + String.join(", ", reasons) + ")";
    }
    if (!tier.isUnlimited() && days > tier.maxDays()) {
      return "Retention period cannot exceed " + tier.maxDays() + " days for " + tier.value()
          + " tier. Upgrade to enterprise for longer retention.";
    }
    return null;
  }

  /**
   * Checks a whole policy.
   *
   * @return violations, empty when the policy is allowed
   */
  public static List<String> validate(RetentionPolicy policy, RetentionTier tier) {
    List<String> violations = new ArrayList<>();
    String reportError = validateRetentionDays(policy.bugReportRetentionDays(), tier,
        policy.dataClassification(), policy.complianceRegion());
    if (reportError != null) {
      violations.add(reportError);
    }
    return violations;
  }
}
