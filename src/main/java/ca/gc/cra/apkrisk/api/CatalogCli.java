package ca.gc.cra.apkrisk.api;

import ca.gc.cra.apkrisk.application.scoring.ScoringConfig;
import ca.gc.cra.apkrisk.application.scoring.ScoringTable;
import ca.gc.cra.apkrisk.domain.assessment.ScoreBands;
import ca.gc.cra.apkrisk.domain.error.ConfigurationException;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricSpec;
import ca.gc.cra.apkrisk.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the metric table: catalog defaults, or the effective table after configured overrides.
 *
 * @since 0.1.0
 */
public final class CatalogCli {
  private static final Logger log = LoggerFactory.getLogger(CatalogCli.class);
  private static final String SUMMARY_USAGE =
      "usage: catalog [config=YAML] [weights.<metric>=W] [caps.<metric>=N] [bands.medium=N] [bands.high=N]";
  private static final String HELP_TEXT = """
      APKRISK catalog

      Usage:
        catalog [options]

      Prints every scored metric with its source, kind, weight and cap. Overrides are applied and
      validated exactly as assess would apply them.

      Options:
        config=YAML               YAML file with common/assess sections (assess overrides apply)
        weights.<metric>=W        Weight override in [0,1]
        caps.<metric>=N           Cap override for a count metric
        bands.medium=N            Lowest score labelled Medium
        bands.high=N              Lowest score labelled High
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private CatalogCli() {}

  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    Map<String, String> effective;
    try {
      input.rejectUnknownFlags();
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      // Scoring overrides live in the assess section of a shared YAML file.
      effective = ConfigCliUtils.effectiveConfig("catalog", "assess", kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    try {
      ScoringTable table = ScoringTable.resolve(MetricCatalog.defaults(), ScoringConfig.fromFlatMap(effective));
      CliPrinter.printBlock(render(table));
      return ExitCode.SUCCESS;
    } catch (ConfigurationException ex) {
      log.error("Invalid scoring configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
  }

  static String render(ScoringTable table) {
    List<String[]> rows = new ArrayList<>();
    rows.add(new String[] {"metric", "source", "kind", "weight", "cap", "extractor"});
    for (ScoringTable.Entry entry : table.entries()) {
      MetricSpec spec = entry.spec();
      rows.add(new String[] {
          spec.name(),
          spec.source().name().toLowerCase(Locale.ROOT),
          spec.kind().name().toLowerCase(Locale.ROOT),
          String.format(Locale.ROOT, "%.2f", entry.weight()),
          entry.cap() == null ? "-" : Long.toString(entry.cap()),
          spec.extractorId().map(ExtractorId::key).orElse("-")
      });
    }
    int[] widths = new int[rows.get(0).length];
    for (String[] row : rows) {
      for (int i = 0; i < row.length; i++) {
        widths[i] = Math.max(widths[i], row[i].length());
      }
    }
    StringBuilder sb = new StringBuilder();
    for (String[] row : rows) {
      for (int i = 0; i < row.length; i++) {
        sb.append(i == row.length - 1 ? row[i] : pad(row[i], widths[i] + 2));
      }
      sb.append('\n');
    }
    ScoreBands bands = table.bands();
    sb.append(String.format(Locale.ROOT, "total weight: %.2f", table.totalWeight())).append('\n');
    sb.append("bands: Low < ").append(bands.mediumFloor())
        .append(" <= Medium < ").append(bands.highFloor())
        .append(" <= High\n");
    return sb.toString();
  }

  private static String pad(String value, int width) {
    StringBuilder sb = new StringBuilder(value);
    while (sb.length() < width) {
      sb.append(' ');
    }
    return sb.toString();
  }
}
