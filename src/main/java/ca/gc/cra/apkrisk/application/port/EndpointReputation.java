package ca.gc.cra.apkrisk.application.port;

/**
 * Port answering whether a network endpoint is known to be malicious.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EndpointReputation {
  /**
   * Checks a host (domain name or IP literal) against threat intelligence.
   *
   * @param host lower-case host without scheme or port; never {@code null}
   * @return {@code true} when the host is flagged
   */
  boolean isMalicious(String host);

  /** Reputation source that flags nothing. */
  EndpointReputation NONE = host -> false;
}
