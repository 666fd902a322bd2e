package ca.gc.cra.apkrisk.application.extract;

import java.util.Map;

/** Shared count resolution for list-or-count findings. */
final class CountFindings {
  private CountFindings() {}

  static long count(Map<String, Object> findings, String listKey, String countKey) {
    Object list = findings.get(listKey);
    if (list != null) {
      return RawFindings.countEntries(list, listKey);
    }
    Object count = findings.get(countKey);
    if (count != null) {
      return RawFindings.toCount(count, countKey);
    }
    throw new IllegalArgumentException("findings require " + listKey + " or " + countKey);
  }
}
