package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Computes the dangerous-permission density from permission findings.
 *
 * <p>Three shapes are accepted, in order of preference: a precomputed {@code permission_density}, a
 * {@code permissions} list, or {@code total_permission_count}/{@code dangerous_permission_count}. List
 * entries may be plain permission names or {@code {name, dangerous}} mappings; entries without an
 * explicit flag are classified against {@link #DANGEROUS_PERMISSIONS}.</p>
 *
 * @since 0.1.0
 */
public final class PermissionsAdapter implements ExtractorAdapter {
  /** Android runtime permissions with the {@code dangerous} protection level. */
  static final Set<String> DANGEROUS_PERMISSIONS = Set.of(
      "android.permission.READ_CALENDAR",
      "android.permission.WRITE_CALENDAR",
      "android.permission.CAMERA",
      "android.permission.READ_CONTACTS",
      "android.permission.WRITE_CONTACTS",
      "android.permission.GET_ACCOUNTS",
      "android.permission.ACCESS_FINE_LOCATION",
      "android.permission.ACCESS_COARSE_LOCATION",
      "android.permission.RECORD_AUDIO",
      "android.permission.READ_PHONE_STATE",
      "android.permission.CALL_PHONE",
      "android.permission.READ_CALL_LOG",
      "android.permission.WRITE_CALL_LOG",
      "com.android.voicemail.permission.ADD_VOICEMAIL",
      "android.permission.USE_SIP",
      "android.permission.PROCESS_OUTGOING_CALLS",
      "android.permission.BODY_SENSORS",
      "android.permission.SEND_SMS",
      "android.permission.RECEIVE_SMS",
      "android.permission.READ_SMS",
      "android.permission.RECEIVE_WAP_PUSH",
      "android.permission.RECEIVE_MMS",
      "android.permission.READ_EXTERNAL_STORAGE",
      "android.permission.WRITE_EXTERNAL_STORAGE");

  @Override
  public ExtractorId id() {
    return ExtractorId.PERMISSIONS;
  }

  @Override
  public List<MetricValue> adapt(Map<String, Object> findings) {
    return List.of(
        MetricValue.continuous(MetricNames.PERMISSION_DENSITY, MetricSource.STATIC, density(findings)));
  }

  private static double density(Map<String, Object> findings) {
    Object precomputed = findings.get("permission_density");
    if (precomputed != null) {
      double value = RawFindings.toDouble(precomputed, "permission_density");
      if (value < 0.0 || value > 1.0) {
        throw new IllegalArgumentException("permission_density must be within [0,1] (was " + value + ")");
      }
      return value;
    }
    Object listNode = findings.get("permissions");
    if (listNode != null) {
      if (!(listNode instanceof Iterable<?> permissions)) {
        throw new IllegalArgumentException("permissions must be a list");
      }
      long total = 0;
      long dangerous = 0;
      for (Object entry : permissions) {
        total++;
        if (isDangerous(entry)) {
          dangerous++;
        }
      }
      return RawFindings.ratio(dangerous, total, "dangerous permissions");
    }
    OptionalLong total = RawFindings.optionalCount(findings, "total_permission_count");
    OptionalLong dangerous = RawFindings.optionalCount(findings, "dangerous_permission_count");
    if (total.isEmpty() || dangerous.isEmpty()) {
      throw new IllegalArgumentException(
          "permission findings require permission_density, permissions, or permission counts");
    }
    return RawFindings.ratio(dangerous.getAsLong(), total.getAsLong(), "dangerous_permission_count");
  }

  private static boolean isDangerous(Object entry) {
    if (entry instanceof String name) {
      return DANGEROUS_PERMISSIONS.contains(name.trim());
    }
    Map<String, Object> map = RawFindings.asMap(entry, "permission");
    Object flag = map.get("dangerous");
    if (flag != null) {
      return RawFindings.toBoolean(flag, "dangerous");
    }
    Object name = map.get("name");
    return name != null && DANGEROUS_PERMISSIONS.contains(name.toString().trim());
  }
}
