package ca.gc.cra.apkrisk.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-key
 * invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    // An explicit input on the CLI replaces whichever input the YAML named.
    if (cliCopy.containsKey("job") && !cliCopy.containsKey("artifacts")) {
      merged.remove("artifacts");
    }
    if (cliCopy.containsKey("artifacts") && !cliCopy.containsKey("job")) {
      merged.remove("job");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(command, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String command, Map<String, String> effective) {
    if (!"assess".equalsIgnoreCase(command)) {
      return;
    }
    boolean hasJob = !trim(effective.get("job")).isEmpty();
    boolean hasArtifacts = !trim(effective.get("artifacts")).isEmpty();
    if (hasJob == hasArtifacts) {
      throw new IllegalArgumentException("Exactly one of job or artifacts is required for assess");
    }
    String format = trim(effective.get("format")).toLowerCase(Locale.ROOT);
    if (!format.isEmpty() && !format.equals("json") && !format.equals("text")) {
      throw new IllegalArgumentException("format must be 'json' or 'text'");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
