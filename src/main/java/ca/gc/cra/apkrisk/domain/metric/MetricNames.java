package ca.gc.cra.apkrisk.domain.metric;

/**
 * Names of the metrics in the default catalog.
 *
 * @since 0.1.0
 */
public final class MetricNames {
  public static final String PERMISSION_DENSITY = "permission_density";
  public static final String COMPONENT_EXPOSURE = "component_exposure";
  public static final String DEBUGGABLE_APPLICATION = "debuggable_application";
  public static final String CLEARTEXT_TRAFFIC_PERMITTED = "cleartext_traffic_permitted";
  public static final String MISSING_CERTIFICATE_PINNING = "missing_certificate_pinning";
  public static final String DEBUG_OVERRIDES = "debug_overrides";
  public static final String HARDCODED_SECRET_COUNT = "hardcoded_secret_count";
  public static final String VULNERABLE_DEPENDENCY_COUNT = "vulnerable_dependency_count";
  public static final String EXPIRED_CERTIFICATE = "expired_certificate";
  public static final String SELF_SIGNED_CERTIFICATE = "self_signed_certificate";
  public static final String UNTRUSTED_SIGNATURE = "untrusted_signature";
  public static final String YARA_MATCH_COUNT = "yara_match_count";
  public static final String PERMISSION_INVOCATION_COUNT = "permission_invocation_count";
  public static final String CLEARTEXT_ENDPOINT_COUNT = "cleartext_endpoint_count";
  public static final String FILE_WRITE_COUNT = "file_write_count";
  public static final String MALICIOUS_ENDPOINT_COUNT = "malicious_endpoint_count";
  public static final String OTHER_EVENT_COUNT = "other_event_count";

  private MetricNames() {}
}
