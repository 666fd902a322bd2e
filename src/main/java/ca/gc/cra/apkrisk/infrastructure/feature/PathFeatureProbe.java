package ca.gc.cra.apkrisk.infrastructure.feature;

import ca.gc.cra.apkrisk.application.port.FeatureProbe;
import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;
import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FeatureProbe} that looks for the command-line tools behind each optional capability on the
 * executable search path.
 *
 * <p>Capabilities without a mapped executable are reported as available.</p>
 *
 * @since 0.1.0
 */
public final class PathFeatureProbe implements FeatureProbe {
  private static final Logger log = LoggerFactory.getLogger(PathFeatureProbe.class);

  /** Executables probed by default. */
  public static final Map<OptionalFeature, String> DEFAULT_EXECUTABLES = Map.of(
      OptionalFeature.NETWORK_SECURITY_PARSER, "apktool",
      OptionalFeature.SECRET_SCANNER, "jadx",
      OptionalFeature.CERTIFICATE_PARSER, "keytool",
      OptionalFeature.SIGNATURE_VERIFIER, "apksigner",
      OptionalFeature.YARA_ENGINE, "yara");

  private final List<Path> searchPath;
  private final Map<OptionalFeature, String> executables;

  /**
   * Creates a probe over explicit search directories.
   *
   * @param searchPath directories to search, in order
   * @param executables executable name per capability
   */
  public PathFeatureProbe(List<Path> searchPath, Map<OptionalFeature, String> executables) {
    this.searchPath = List.copyOf(Objects.requireNonNull(searchPath, "searchPath"));
    Map<OptionalFeature, String> copy = new EnumMap<>(OptionalFeature.class);
    copy.putAll(Objects.requireNonNull(executables, "executables"));
    this.executables = copy;
  }

  /**
   * Creates a probe over the process {@code PATH} with the default executables.
   *
   * @return probe
   */
  public static PathFeatureProbe fromEnvironment() {
    String path = System.getenv("PATH");
    List<Path> dirs = new ArrayList<>();
    if (path != null) {
      for (String entry : path.split(File.pathSeparator)) {
        if (!entry.isBlank()) {
          dirs.add(Path.of(entry));
        }
      }
    }
    return new PathFeatureProbe(dirs, DEFAULT_EXECUTABLES);
  }

  @Override
  public FeatureAvailability probe() {
    Set<OptionalFeature> available = EnumSet.noneOf(OptionalFeature.class);
    for (OptionalFeature feature : OptionalFeature.values()) {
      String executable = executables.get(feature);
      if (executable == null || onSearchPath(executable)) {
        available.add(feature);
      } else {
        log.debug("Executable {} for {} not found on search path", executable, feature.label());
      }
    }
    return FeatureAvailability.of(available);
  }

  private boolean onSearchPath(String executable) {
    for (Path dir : searchPath) {
      Path candidate = dir.resolve(executable);
      if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
        return true;
      }
    }
    return false;
  }
}
