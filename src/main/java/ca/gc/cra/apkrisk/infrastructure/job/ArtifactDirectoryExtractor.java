package ca.gc.cra.apkrisk.infrastructure.job;

import ca.gc.cra.apkrisk.application.port.StaticExtractor;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import ca.gc.cra.apkrisk.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link StaticExtractor} that reads the {@code <extractor>.json} file the extraction subsystem left in an
 * artifact directory.
 *
 * <p>A missing file yields {@link ExtractorResult.Unavailable}. A file whose content is a JSON string is
 * an explicit unavailability marker with that string as reason. Certificate findings may also be stored as
 * {@code certificates.json}.</p>
 *
 * @since 0.1.0
 */
public final class ArtifactDirectoryExtractor implements StaticExtractor {
  /** Optional hook log inside an artifact directory. */
  public static final String EVENTS_FILE = "events.log";

  private final ExtractorId id;
  private final JsonSupport json;

  /**
   * Creates an extractor for one concern.
   *
   * @param id extractor to read
   * @param json JSON parser
   */
  public ArtifactDirectoryExtractor(ExtractorId id, JsonSupport json) {
    this.id = Objects.requireNonNull(id, "id");
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Creates one extractor per {@link ExtractorId}.
   *
   * @param json JSON parser
   * @return extractors in declaration order
   */
  public static List<ArtifactDirectoryExtractor> forAllExtractors(JsonSupport json) {
    List<ArtifactDirectoryExtractor> extractors = new ArrayList<>();
    for (ExtractorId id : ExtractorId.values()) {
      extractors.add(new ArtifactDirectoryExtractor(id, json));
    }
    return extractors;
  }

  @Override
  public ExtractorId id() {
    return id;
  }

  @Override
  public ExtractorResult extract(Path target) throws IOException {
    Path file = locate(target);
    if (file == null) {
      return ExtractorResult.unavailable("no " + id.key() + ".json artifact in " + target);
    }
    Object content = json.parse(file);
    if (content instanceof String reason) {
      return ExtractorResult.unavailable(reason);
    }
    if (!(content instanceof Map<?, ?> raw)) {
      throw new IOException(file + " must contain a JSON object");
    }
    Map<String, Object> findings = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      findings.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return ExtractorResult.present(findings);
  }

  private Path locate(Path target) {
    Path primary = target.resolve(id.key() + ".json");
    if (Files.isRegularFile(primary)) {
      return primary;
    }
    if (id == ExtractorId.CRYPTO) {
      Path alias = target.resolve("certificates.json");
      if (Files.isRegularFile(alias)) {
        return alias;
      }
    }
    return null;
  }
}
