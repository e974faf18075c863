package bugtrail.retention;

import bugtrail.model.ComplianceRegion;
import bugtrail.model.DataClassification;
import bugtrail.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Issues and verifies {@link DeletionCertificate}s.
 *
 * <p>The verification hash is the hex SHA-256 of the compact JSON object
 * {@code {certificateId, projectId, reportIds, deletedAt, complianceRegion}} with the keys in
 * that order, report ids sorted and {@code deletedAt} in ISO-8601 UTC with millisecond
 * precision.
 */
public final class DeletionCertificates {
  public static final String SYSTEM_USER = "system";

  private static final DateTimeFormatter ISO_MILLIS = DateTimeFormatter.ISO_INSTANT;

  private DeletionCertificates() {}

  /**
   * Creates a certificate with a fresh random id.
   *
   * @param deletedBy acting user, or {@code null} for {@value #SYSTEM_USER}
   */
  public static DeletionCertificate issue(String projectId, Collection<String> reportIds,
      Instant deletedAt, String deletedBy, DeletionReason reason,
      DataClassification classification, ComplianceRegion region, JsonCodec jsonCodec) {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(reportIds, "reportIds");
    Objects.requireNonNull(deletedAt, "deletedAt");
    ComplianceRegion effectiveRegion = region == null ? ComplianceRegion.NONE : region;
    String certificateId = UUID.randomUUID().toString();
    List<String> sorted = reportIds.stream().sorted().toList();
    String hash = computeHash(certificateId, projectId, sorted, deletedAt, effectiveRegion, jsonCodec);
    return new DeletionCertificate(
        certificateId,
        projectId,
        sorted,
        deletedAt,
        deletedBy == null ? SYSTEM_USER : deletedBy,
        reason == null ? DeletionReason.MANUAL : reason,
        classification,
        effectiveRegion,
        hash,
        Instant.now());
  }

  /**
   * Computes the verification hash. The order of {@code reportIds} does not matter.
   */
  public static String computeHash(String certificateId, String projectId, Collection<String> reportIds,
      Instant deletedAt, ComplianceRegion region, JsonCodec jsonCodec) {
    Map<String, Object> canonical = new LinkedHashMap<>();
    canonical.put("certificateId", certificateId);
    canonical.put("projectId", projectId);
    canonical.put("reportIds", reportIds.stream().sorted().toList());
    canonical.put("deletedAt", formatInstant(deletedAt));
    canonical.put("complianceRegion", (region == null ? ComplianceRegion.NONE : region).value());
    return sha256Hex(jsonCodec.toJson(canonical));
  }

  /**
   * Recomputes the hash of an issued certificate and compares it with the stored one.
   */
  public static boolean verify(DeletionCertificate certificate, JsonCodec jsonCodec) {
    String expected = computeHash(certificate.certificateId(), certificate.projectId(),
        certificate.reportIds(), certificate.deletedAt(), certificate.complianceRegion(), jsonCodec);
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        String.valueOf(certificate.verificationHash()).getBytes(StandardCharsets.US_ASCII));
  }

  public static boolean verify(DeletionCertificate certificate) {
    return verify(certificate, JsonCodec.getDefault());
  }

  // Always three fraction digits, like 2024-01-15T10:00:00.000Z.
  static String formatInstant(Instant instant) {
    Instant millis = instant.truncatedTo(ChronoUnit.MILLIS);
    String text = ISO_MILLIS.format(millis);
    if (millis.getNano() == 0) {
      return text.substring(0, text.length() - 1) + ".000Z";
    }
    return text;
  }

  private static String sha256Hex(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
