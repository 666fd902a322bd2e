package ca.gc.cra.apkrisk.api;

import ca.gc.cra.apkrisk.validation.Strings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI tokens into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits each token on its first {@code '='}. Dotted keys such as {@code weights.permission_density}
   * are kept verbatim.
   *
   * @param tokens key/value tokens; {@code null} returns an empty map
   * @return mutable map in command-line order
   * @throws IllegalArgumentException for malformed tokens, invalid keys or repeated keys
   */
  static Map<String, String> toMap(List<String> tokens) {
    Map<String, String> map = new LinkedHashMap<>();
    if (tokens == null) {
      return map;
    }
    for (String token : tokens) {
      int idx = token.indexOf('=');
      if (idx <= 0 || idx == token.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + token + "')");
      }
      String key = token.substring(0, idx).trim();
      String value = token.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      validateValue(key, value);
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " supplied more than once");
      }
    }
    return map;
  }

  private static void validateValue(String key, String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
    Strings.requireNonBlank(key, value);
  }
}
