package ca.gc.cra.apkrisk.application.ingest;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts scheme and host from {@code NETWORK} event payloads.
 *
 * <p>Payloads are usually absolute URIs ({@code http://host/path}); bare {@code host[:port][/path]}
 * values are accepted and carry no scheme.</p>
 */
final class EndpointClassifier {
  static final Set<String> CLEARTEXT_SCHEMES = Set.of("http", "ws", "ftp", "telnet");

  private EndpointClassifier() {}

  static boolean isCleartext(String payload) {
    return scheme(payload).map(CLEARTEXT_SCHEMES::contains).orElse(false);
  }

  static Optional<String> scheme(String payload) {
    String trimmed = payload == null ? "" : payload.trim();
    int separator = trimmed.indexOf("://");
    if (separator <= 0) {
      return Optional.empty();
    }
    return Optional.of(trimmed.substring(0, separator).toLowerCase(Locale.ROOT));
  }

  static Optional<String> host(String payload) {
    String trimmed = payload == null ? "" : payload.trim();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    int separator = trimmed.indexOf("://");
    if (separator >= 0) {
      trimmed = trimmed.substring(separator + 3);
    }
    int end = trimmed.length();
    for (char stop : new char[] {'/', '?', '#'}) {
      int idx = trimmed.indexOf(stop);
      if (idx >= 0 && idx < end) {
        end = idx;
      }
    }
    String authority = trimmed.substring(0, end);
    int at = authority.lastIndexOf('@');
    if (at >= 0) {
      authority = authority.substring(at + 1);
    }
    String host;
    if (authority.startsWith("[")) {
      int close = authority.indexOf(']');
      host = close > 0 ? authority.substring(1, close) : authority.substring(1);
    } else {
      int colon = authority.indexOf(':');
      host = colon >= 0 && authority.indexOf(':', colon + 1) < 0 ? authority.substring(0, colon) : authority;
    }
    host = host.toLowerCase(Locale.ROOT);
    return host.isEmpty() ? Optional.empty() : Optional.of(host);
  }
}
