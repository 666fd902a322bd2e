package ca.gc.cra.apkrisk.domain.extract;

import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import java.util.Locale;
import java.util.Optional;

/**
 * Static extractors whose findings feed the risk score.
 *
 * <p>Manifest and permission data are mandatory: without them there is no baseline to assess. Every
 * other extractor is backed by an {@link OptionalFeature} and may be skipped.</p>
 *
 * @since 0.1.0
 */
public enum ExtractorId {
  MANIFEST("manifest", null),
  PERMISSIONS("permissions", null),
  NETWORK_SECURITY("network_security", OptionalFeature.NETWORK_SECURITY_PARSER),
  SECRETS("secrets", OptionalFeature.SECRET_SCANNER),
  DEPENDENCIES("dependencies", OptionalFeature.DEPENDENCY_SCANNER),
  CRYPTO("crypto", OptionalFeature.CERTIFICATE_PARSER),
  SIGNATURE("signature", OptionalFeature.SIGNATURE_VERIFIER),
  YARA("yara", OptionalFeature.YARA_ENGINE);

  private final String key;
  private final OptionalFeature feature;

  ExtractorId(String key, OptionalFeature feature) {
    this.key = key;
    this.feature = feature;
  }

  /**
   * Returns the wire name used in job files and artifact directories.
   *
   * @return lower-case extractor key
   */
  public String key() {
    return key;
  }

  /**
   * Indicates whether the extractor's absence fails the job.
   *
   * @return {@code true} for manifest and permissions
   */
  public boolean mandatory() {
    return feature == null;
  }

  /**
   * Returns the optional capability backing this extractor.
   *
   * @return feature, or empty for mandatory extractors
   */
  public Optional<OptionalFeature> feature() {
    return Optional.ofNullable(feature);
  }

  /**
   * Resolves an extractor from its wire name. {@code certificates} is accepted as an alias of
   * {@code crypto}.
   *
   * @param value extractor key
   * @return matching extractor
   * @throws IllegalArgumentException for unknown keys
   */
  public static ExtractorId fromKey(String value) {
    if (value == null) {
      throw new IllegalArgumentException("extractor name must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("certificates")) {
      return CRYPTO;
    }
    for (ExtractorId id : values()) {
      if (id.key.equals(normalized)) {
        return id;
      }
    }
    throw new IllegalArgumentException("Unknown extractor: " + value);
  }
}
