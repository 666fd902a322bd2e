package ca.gc.cra.apkrisk.application.pipeline;

import ca.gc.cra.apkrisk.application.port.MetricsPort;
import ca.gc.cra.apkrisk.application.port.StaticExtractor;
import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs static extractors concurrently and joins them before scoring.
 * <p><strong>Why:</strong> Decompilation-backed scanners are slow and independent; running them in parallel
 * shortens jobs while the join barrier keeps every result either present or explicitly unavailable.</p>
 * <p><strong>Failure handling:</strong> An extractor that throws or exceeds the timeout yields
 * {@link ExtractorResult.Unavailable} with a WARN log. Interrupting the caller cancels outstanding calls and
 * propagates {@link InterruptedException}.</p>
 * <p><strong>Thread-safety:</strong> Each {@link #collect} call uses its own pool, shut down before
 * returning.</p>
 * <p><strong>Observability:</strong> Emits {@code extract.calls.failed}.</p>
 *
 * @since 0.1.0
 */
public final class StaticExtractionCoordinator {
  private static final Logger log = LoggerFactory.getLogger(StaticExtractionCoordinator.class);

  private final IntFunction<ExecutorService> poolFactory;
  private final int maxThreads;
  private final Duration timeout;
  private final MetricsPort metrics;

  /**
   * Creates a coordinator.
   *
   * @param poolFactory creates a pool with the requested number of threads
   * @param maxThreads upper bound on concurrent extractor calls
   * @param timeout overall budget for one collection round
   * @param metrics metrics sink
   */
  public StaticExtractionCoordinator(
      IntFunction<ExecutorService> poolFactory, int maxThreads, Duration timeout, MetricsPort metrics) {
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
    if (maxThreads <= 0) {
      throw new IllegalArgumentException("maxThreads must be positive");
    }
    this.maxThreads = maxThreads;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Invokes every extractor against {@code target} and waits for all of them.
   *
   * @param target analysis target passed to each extractor
   * @param extractors extractors to run; at most one per {@link ExtractorId}
   * @return one result per supplied extractor
   * @throws InterruptedException if interrupted while waiting
   */
  public Map<ExtractorId, ExtractorResult> collect(Path target, List<? extends StaticExtractor> extractors)
      throws InterruptedException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(extractors, "extractors");
    Map<ExtractorId, ExtractorResult> results = new EnumMap<>(ExtractorId.class);
    if (extractors.isEmpty()) {
      return results;
    }
    Set<ExtractorId> seen = EnumSet.noneOf(ExtractorId.class);
    for (StaticExtractor extractor : extractors) {
      if (!seen.add(extractor.id())) {
        throw new IllegalArgumentException("Duplicate extractor " + extractor.id().key());
      }
    }

    String jobId = MDC.get("jobId");
    List<Callable<ExtractorResult>> tasks = new ArrayList<>(extractors.size());
    for (StaticExtractor extractor : extractors) {
      tasks.add(() -> runOne(extractor, target, jobId));
    }

    ExecutorService executor = poolFactory.apply(Math.min(maxThreads, extractors.size()));
    try {
      List<Future<ExtractorResult>> futures =
          executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
      for (int i = 0; i < futures.size(); i++) {
        ExtractorId id = extractors.get(i).id();
        results.put(id, resultOf(id, futures.get(i)));
      }
    } catch (InterruptedException ex) {
      log.warn("Static extraction interrupted; cancelling outstanding extractor calls");
      throw ex;
    } finally {
      executor.shutdownNow();
    }
    return results;
  }

  private ExtractorResult runOne(StaticExtractor extractor, Path target, String jobId) throws Exception {
    if (jobId != null) {
      MDC.put("jobId", jobId);
    }
    MDC.put("extractor", extractor.id().key());
    try {
      log.debug("Extractor {} started", extractor.id().key());
      ExtractorResult result = Objects.requireNonNull(extractor.extract(target), "extractor result");
      log.debug("Extractor {} finished: {}", extractor.id().key(), result.getClass().getSimpleName());
      return result;
    } finally {
      MDC.remove("extractor");
      MDC.remove("jobId");
    }
  }

  private ExtractorResult resultOf(ExtractorId id, Future<ExtractorResult> future) throws InterruptedException {
    try {
      return future.get();
    } catch (CancellationException ex) {
      metrics.increment("extract.calls.failed");
      log.warn("Extractor {} timed out after {} ms; treating as unavailable", id.key(), timeout.toMillis());
      return ExtractorResult.unavailable("timed out after " + timeout.toMillis() + " ms");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      metrics.increment("extract.calls.failed");
      log.warn("Extractor {} failed; treating as unavailable", id.key(), cause);
      return ExtractorResult.unavailable("failed: " + cause.getMessage());
    }
  }
}
