package ca.gc.cra.apkrisk.application.extract;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Accessors for the JSON-like findings trees reported by extractors.
 *
 * <p>Every helper throws {@link IllegalArgumentException} on a shape mismatch. The adapter layer treats
 * that as malformed findings.</p>
 */
final class RawFindings {
  private RawFindings() {}

  static Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  static Map<String, Object> asMapOrEmpty(Object node, String context) {
    return node == null ? Map.of() : asMap(node, context);
  }

  static boolean toBoolean(Object value, String context) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      String normalized = str.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "true", "yes", "1" -> true;
        case "false", "no", "0" -> false;
        default -> throw new IllegalArgumentException("Invalid boolean for " + context + ": '" + str + "'");
      };
    }
    if (value instanceof Number number) {
      return number.doubleValue() != 0.0;
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }

  static boolean booleanOrDefault(Map<String, Object> map, String key, boolean fallback) {
    Object value = map.get(key);
    return value == null ? fallback : toBoolean(value, key);
  }

  static long toCount(Object value, String context) {
    long count;
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (d != Math.rint(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Invalid count for " + context + ": " + value);
      }
      count = number.longValue();
    } else if (value instanceof String str && !str.isBlank()) {
      try {
        count = Long.parseLong(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid count for " + context + ": '" + str + "'", ex);
      }
    } else {
      throw new IllegalArgumentException("Invalid count for " + context + ": " + value);
    }
    if (count < 0) {
      throw new IllegalArgumentException("Negative count for " + context + ": " + count);
    }
    return count;
  }

  static OptionalLong optionalCount(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value == null ? OptionalLong.empty() : OptionalLong.of(toCount(value, key));
  }

  static double toDouble(Object value, String context) {
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("Invalid number for " + context + ": " + value);
      }
      return d;
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return toDouble(Double.parseDouble(str.trim()), context);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number for " + context + ": '" + str + "'", ex);
      }
    }
    throw new IllegalArgumentException("Invalid number for " + context + ": " + value);
  }

  static double ratio(long part, long total, String context) {
    if (part > total) {
      throw new IllegalArgumentException(context + ": " + part + " exceeds total " + total);
    }
    return total == 0 ? 0.0 : (double) part / total;
  }

  /**
   * Counts entries in a list, or the sum of list sizes in a map of lists.
   */
  static long countEntries(Object node, String context) {
    if (node instanceof Iterable<?> iterable) {
      long count = 0;
      for (Object ignored : iterable) {
        count++;
      }
      return count;
    }
    if (node instanceof Map<?, ?> map) {
      long count = 0;
      for (Object value : map.values()) {
        count += value == null ? 0 : countEntries(value, context);
      }
      return count;
    }
    throw new IllegalArgumentException(context + " must be a list or a mapping of lists");
  }
}
