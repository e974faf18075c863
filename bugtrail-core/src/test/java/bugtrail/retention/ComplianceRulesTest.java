package bugtrail.retention;

import bugtrail.model.ComplianceRegion;
import bugtrail.model.DataClassification;
import bugtrail.model.RetentionPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceRulesTest {

  @Test
  void regionalMinimums() {
    assertEquals(365, ComplianceRules.minRetentionDays(ComplianceRegion.EU, DataClassification.FINANCIAL));
    assertEquals(2555, ComplianceRules.minRetentionDays(ComplianceRegion.US, DataClassification.HEALTHCARE));
    assertEquals(90, ComplianceRules.minRetentionDays(ComplianceRegion.KZ, DataClassification.GENERAL));
    assertEquals(3650, ComplianceRules.minRetentionDays(ComplianceRegion.CA, DataClassification.HEALTHCARE));
    assertEquals(0, ComplianceRules.minRetentionDays(ComplianceRegion.EU, DataClassification.GENERAL));
    assertEquals(0, ComplianceRules.minRetentionDays(ComplianceRegion.NONE, DataClassification.FINANCIAL));
    assertEquals(0, ComplianceRules.minRetentionDays(null, DataClassification.FINANCIAL));
  }

  @Test
  void deletionAndCertificateRegions() {
    assertTrue(ComplianceRules.requiresTrueDeletion(ComplianceRegion.KZ));
    assertTrue(ComplianceRules.requiresTrueDeletion(ComplianceRegion.EU));
    assertFalse(ComplianceRules.requiresTrueDeletion(ComplianceRegion.US));

    assertTrue(ComplianceRules.requiresCertificate(ComplianceRegion.US));
    assertTrue(ComplianceRules.requiresCertificate(ComplianceRegion.KZ));
    assertFalse(ComplianceRules.requiresCertificate(ComplianceRegion.UK));
    assertFalse(ComplianceRules.requiresCertificate(null));
  }

  @Test
  void tierMinimumMessage() {
    assertEquals("Retention period must be at least 7 days (tier minimum: 7 days)",
        ComplianceRules.validateRetentionDays(5, RetentionTier.FREE, DataClassification.GENERAL,
            ComplianceRegion.NONE));
  }

  @Test
  void complianceMinimumMessage() {
    assertEquals("Retention period must be at least 1825 days (KZ compliance: 1825 days)",
        ComplianceRules.validateRetentionDays(30, RetentionTier.FREE, DataClassification.FINANCIAL,
            ComplianceRegion.KZ));
  }

  @Test
  void freeTierMaximumMessage() {
    assertEquals("Retention period cannot exceed 60 days for free tier. Upgrade to enterprise for longer retention.",
        ComplianceRules.validateRetentionDays(61, RetentionTier.FREE, DataClassification.GENERAL,
            ComplianceRegion.NONE));
  }

  @Test
  void enterpriseHasNoMaximum() {
    assertNull(ComplianceRules.validateRetentionDays(10_000, RetentionTier.ENTERPRISE,
        DataClassification.GENERAL, ComplianceRegion.NONE));
    assertNull(ComplianceRules.validateRetentionDays(60, RetentionTier.FREE,
        DataClassification.GENERAL, ComplianceRegion.NONE));
  }

  @Test
  void validatePolicy() {
    RetentionPolicy policy = RetentionPolicy.of(30, false)
        .withCompliance(DataClassification.HEALTHCARE, ComplianceRegion.US);

    List<String> violations = ComplianceRules.validate(policy, RetentionTier.ENTERPRISE);

    assertEquals(1, violations.size());
    assertTrue(violations.get(0).contains("US compliance: 2555 days"));
    assertTrue(ComplianceRules.validate(RetentionPolicy.of(30, false), RetentionTier.PROFESSIONAL).isEmpty());
  }

  @Test
  void defaultPolicy() {
    RetentionPolicy policy = ComplianceRules.defaultPolicy();

    assertEquals(90, policy.bugReportRetentionDays());
    assertEquals(60, policy.screenshotRetentionDays());
    assertEquals(30, policy.replayRetentionDays());
    assertEquals(365, policy.archivedRetentionDays());
    assertTrue(policy.archiveBeforeDelete());
  }

  @Test
  void freeTierPolicyIsCapped() {
    RetentionPolicy policy = ComplianceRules.policyForTier(RetentionTier.FREE, DataClassification.GENERAL,
        ComplianceRegion.NONE);

    assertEquals(60, policy.bugReportRetentionDays());
    assertEquals(60, policy.screenshotRetentionDays());
    assertEquals(30, policy.replayRetentionDays());
    assertEquals(60, policy.attachmentRetentionDays());
    assertEquals(365, policy.archivedRetentionDays());
  }

  @Test
  void regionalMinimumRaisesTierPolicy() {
    RetentionPolicy policy = ComplianceRules.policyForTier(RetentionTier.ENTERPRISE,
        DataClassification.FINANCIAL, ComplianceRegion.KZ);

    assertEquals(1825, policy.bugReportRetentionDays());
    assertEquals(1825, policy.replayRetentionDays());
    assertEquals(ComplianceRegion.KZ, policy.complianceRegion());
    assertEquals(DataClassification.FINANCIAL, policy.dataClassification());
  }
}
