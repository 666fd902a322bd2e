package ca.gc.cra.apkrisk.application.extract;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Derives component exposure and the debuggable flag from manifest findings.
 *
 * <p>Accepts either a {@code components} mapping of component type to entries with an
 * {@code exported} flag, or precomputed {@code total_component_count}/{@code exported_component_count}.</p>
 *
 * @since 0.1.0
 */
public final class ManifestAdapter implements ExtractorAdapter {
  @Override
  public ExtractorId id() {
    return ExtractorId.MANIFEST;
  }

  @Override
  public List<MetricValue> adapt(Map<String, Object> findings) {
    double exposure = componentExposure(findings);
    Map<String, Object> flags = RawFindings.asMapOrEmpty(findings.get("app_flags"), "app_flags");
    boolean debuggable = RawFindings.booleanOrDefault(flags, "debuggable", false);
    return List.of(
        MetricValue.continuous(MetricNames.COMPONENT_EXPOSURE, MetricSource.STATIC, exposure),
        MetricValue.flag(MetricNames.DEBUGGABLE_APPLICATION, MetricSource.STATIC, debuggable));
  }

  private static double componentExposure(Map<String, Object> findings) {
    Object componentsNode = findings.get("components");
    if (componentsNode != null) {
      long total = 0;
      long exported = 0;
      for (Map.Entry<String, Object> entry :
          RawFindings.asMap(componentsNode, "components").entrySet()) {
        Object list = entry.getValue();
        if (list == null) {
          continue;
        }
        if (!(list instanceof Iterable<?> components)) {
          throw new IllegalArgumentException("components." + entry.getKey() + " must be a list");
        }
        for (Object component : components) {
          total++;
          if (component instanceof Map<?, ?>) {
            Map<String, Object> map = RawFindings.asMap(component, "component");
            if (RawFindings.booleanOrDefault(map, "exported", false)) {
              exported++;
            }
          }
        }
      }
      return RawFindings.ratio(exported, total, "exported components");
    }
    OptionalLong total = RawFindings.optionalCount(findings, "total_component_count");
    OptionalLong exported = RawFindings.optionalCount(findings, "exported_component_count");
    if (total.isEmpty() || exported.isEmpty()) {
      throw new IllegalArgumentException(
          "manifest findings require components or total_component_count/exported_component_count");
    }
    return RawFindings.ratio(exported.getAsLong(), total.getAsLong(), "exported_component_count");
  }
}
