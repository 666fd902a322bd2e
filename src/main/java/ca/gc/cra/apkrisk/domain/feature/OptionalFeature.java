package ca.gc.cra.apkrisk.domain.feature;

/**
 * Optional analysis capabilities whose absence degrades, but never fails, an assessment.
 *
 * <p>Each constant carries the wording used in the neutral "optional feature unavailable" notice: the
 * feature label, the dependency an operator installs, and the capability it enables.</p>
 *
 * @since 0.1.0
 */
public enum OptionalFeature {
  NETWORK_SECURITY_PARSER("network_security", "apktool", "network security config analysis"),
  SECRET_SCANNER("secrets", "jadx", "hardcoded secret detection"),
  DEPENDENCY_SCANNER("dependencies", "a CVE database feed", "vulnerable dependency matching"),
  CERTIFICATE_PARSER("crypto", "cryptography", "signing certificate analysis"),
  SIGNATURE_VERIFIER("signature", "apksigner", "signature verification"),
  YARA_ENGINE("yara", "yara-python", "YARA rule scanning");

  private final String label;
  private final String dependency;
  private final String capability;

  OptionalFeature(String label, String dependency, String capability) {
    this.label = label;
    this.dependency = dependency;
    this.capability = capability;
  }

  /**
   * Returns the short label used in notices and configuration keys.
   *
   * @return feature label, e.g. {@code yara}
   */
  public String label() {
    return label;
  }

  /**
   * Returns the dependency an operator installs to enable the feature.
   *
   * @return dependency description
   */
  public String dependency() {
    return dependency;
  }

  /**
   * Returns a human-readable name of the capability the feature provides.
   *
   * @return capability description
   */
  public String capability() {
    return capability;
  }

  /**
   * Resolves a feature from its label or constant name, ignoring case.
   *
   * @param value label such as {@code yara} or name such as {@code YARA_ENGINE}
   * @return matching feature
   * @throws IllegalArgumentException when nothing matches
   */
  public static OptionalFeature fromLabel(String value) {
    if (value != null) {
      String trimmed = value.trim();
      for (OptionalFeature feature : values()) {
        if (feature.label.equalsIgnoreCase(trimmed) || feature.name().equalsIgnoreCase(trimmed)) {
          return feature;
        }
      }
    }
    throw new IllegalArgumentException("Unknown optional feature: " + value);
  }
}
