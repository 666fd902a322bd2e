package ca.gc.cra.apkrisk.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.apkrisk.domain.assessment.AssessmentNotice;
import ca.gc.cra.apkrisk.domain.assessment.NoticeKind;
import ca.gc.cra.apkrisk.domain.error.MandatoryExtractorMissingException;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;
import ca.gc.cra.apkrisk.domain.feature.OptionalFeature;
import ca.gc.cra.apkrisk.domain.metric.MetricCatalog;
import ca.gc.cra.apkrisk.domain.metric.MetricNames;
import ca.gc.cra.apkrisk.domain.metric.MetricSource;
import ca.gc.cra.apkrisk.domain.metric.MetricValue;
import ca.gc.cra.apkrisk.testing.Findings;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ExtractorAdapterLayerTest {
  private static final String YARA_NOTICE =
      "Optional feature unavailable: `yara` — skipping. Install `yara-python` to enable `YARA rule scanning`.";

  private final MetricCatalog catalog = MetricCatalog.defaults();
  private final ExtractorAdapterLayer layer = ExtractorAdapterLayer.withDefaultAdapters(catalog);

  @Test
  void cleanFindingsProduceEveryStaticMetricInCatalogOrder() throws Exception {
    AdaptedStaticMetrics adapted = layer.adapt(Findings.clean(0.25), FeatureAvailability.allAvailable());

    assertTrue(adapted.notices().isEmpty());
    assertEquals(
        catalog.forSource(MetricSource.STATIC).stream().map(spec -> spec.name()).toList(),
        adapted.metrics().stream().map(MetricValue::name).toList());
    assertEquals(0.25, valueOf(adapted, MetricNames.PERMISSION_DENSITY).rawValue());
    assertEquals(0.0, valueOf(adapted, MetricNames.MISSING_CERTIFICATE_PINNING).rawValue());
    assertTrue(adapted.metrics().stream().allMatch(MetricValue::available));
  }

  @Test
  void missingYaraCapabilityRecordsNeutralNoticeAndPlaceholder() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(ExtractorAdapterLayer.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    AdaptedStaticMetrics adapted;
    try {
      adapted = layer.adapt(Findings.clean(0.25),
          FeatureAvailability.allAvailable().without(OptionalFeature.YARA_ENGINE));
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertEquals(1, adapted.notices().size());
    AssessmentNotice notice = adapted.notices().get(0);
    assertEquals(NoticeKind.OPTIONAL_DEPENDENCY_UNAVAILABLE, notice.kind());
    assertEquals("yara", notice.subject());
    assertEquals(YARA_NOTICE, notice.message());
    assertFalse(valueOf(adapted, MetricNames.YARA_MATCH_COUNT).available());

    List<ILoggingEvent> infos = appender.list.stream().filter(e -> e.getLevel() == Level.INFO).toList();
    assertEquals(1, infos.size());
    assertEquals(YARA_NOTICE + " (capability not installed)", infos.get(0).getFormattedMessage());
  }

  @Test
  void optionalExtractorReportingUnavailableIsNeutral() throws Exception {
    Map<ExtractorId, ExtractorResult> results = Findings.clean(0.1);
    results.put(ExtractorId.CRYPTO, ExtractorResult.unavailable("certificate chain unreadable"));
    results.remove(ExtractorId.SIGNATURE);

    AdaptedStaticMetrics adapted = layer.adapt(results, FeatureAvailability.allAvailable());

    assertEquals(List.of("crypto", "signature"),
        adapted.notices().stream().map(AssessmentNotice::subject).toList());
    assertFalse(valueOf(adapted, MetricNames.EXPIRED_CERTIFICATE).available());
    assertFalse(valueOf(adapted, MetricNames.SELF_SIGNED_CERTIFICATE).available());
    assertFalse(valueOf(adapted, MetricNames.UNTRUSTED_SIGNATURE).available());
  }

  @Test
  void malformedOptionalFindingsAreDiscardedWithWarning() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(ExtractorAdapterLayer.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    Map<ExtractorId, ExtractorResult> results = Findings.clean(0.1);
    results.put(ExtractorId.SECRETS, ExtractorResult.present(Map.<String, Object>of("count", -3)));
    AdaptedStaticMetrics adapted;
    try {
      adapted = layer.adapt(results, FeatureAvailability.allAvailable());
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertEquals("secrets", adapted.notices().get(0).subject());
    assertFalse(valueOf(adapted, MetricNames.HARDCODED_SECRET_COUNT).available());
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
        && e.getFormattedMessage().startsWith("Discarding malformed secrets findings")));
  }

  @Test
  void missingMandatoryExtractorFailsTheJob() {
    Map<ExtractorId, ExtractorResult> results = Findings.clean(0.1);
    results.remove(ExtractorId.PERMISSIONS);

    MandatoryExtractorMissingException ex = assertThrows(MandatoryExtractorMissingException.class,
        () -> layer.adapt(results, FeatureAvailability.allAvailable()));
    assertSame(ExtractorId.PERMISSIONS, ex.extractor());
    assertEquals("Mandatory extractor 'permissions' missing: extractor did not report", ex.getMessage());
  }

  @Test
  void unavailableOrMalformedMandatoryExtractorFailsTheJob() {
    Map<ExtractorId, ExtractorResult> unavailable = Findings.clean(0.1);
    unavailable.put(ExtractorId.MANIFEST, ExtractorResult.unavailable("apk unreadable"));
    MandatoryExtractorMissingException first = assertThrows(MandatoryExtractorMissingException.class,
        () -> layer.adapt(unavailable, FeatureAvailability.allAvailable()));
    assertTrue(first.getMessage().contains("apk unreadable"));

    Map<ExtractorId, ExtractorResult> malformed = Findings.clean(0.1);
    malformed.put(ExtractorId.MANIFEST, ExtractorResult.present(Map.<String, Object>of(
        "total_component_count", 2, "exported_component_count", 5)));
    MandatoryExtractorMissingException second = assertThrows(MandatoryExtractorMissingException.class,
        () -> layer.adapt(malformed, FeatureAvailability.allAvailable()));
    assertTrue(second.getMessage().contains("malformed findings"));
    assertTrue(second.getCause() instanceof IllegalArgumentException);
  }

  @Test
  void rejectsIncompleteAdapterRegistry() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExtractorAdapterLayer(catalog, List.of(new ManifestAdapter(), new PermissionsAdapter())));
    assertThrows(IllegalArgumentException.class, () -> new ExtractorAdapterLayer(catalog, List.of(
        new ManifestAdapter(), new ManifestAdapter())));
  }

  private static MetricValue valueOf(AdaptedStaticMetrics adapted, String name) {
    return adapted.metrics().stream().filter(m -> m.name().equals(name)).findFirst().orElseThrow();
  }
}
