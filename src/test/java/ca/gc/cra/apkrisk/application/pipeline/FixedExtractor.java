package ca.gc.cra.apkrisk.application.pipeline;

import ca.gc.cra.apkrisk.application.port.StaticExtractor;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

record FixedExtractor(ExtractorId id, ExtractorResult result) implements StaticExtractor {
  @Override
  public ExtractorResult extract(Path target) {
    return result;
  }

  static List<StaticExtractor> from(Map<ExtractorId, ExtractorResult> results) {
    List<StaticExtractor> extractors = new ArrayList<>();
    results.forEach((id, result) -> extractors.add(new FixedExtractor(id, result)));
    return extractors;
  }
}
