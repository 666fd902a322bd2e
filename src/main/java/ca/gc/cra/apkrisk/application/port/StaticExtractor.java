package ca.gc.cra.apkrisk.application.port;

import ca.gc.cra.apkrisk.domain.extract.ExtractorId;
import ca.gc.cra.apkrisk.domain.extract.ExtractorResult;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port implemented by the static extraction subsystem for one analysis concern.
 * <p><strong>Why:</strong> Decompilation and scanning happen outside this engine; the port is the boundary
 * where their raw findings enter.</p>
 * <p><strong>Contract:</strong> Return {@link ExtractorResult#unavailable(String)} when the backing tool is not
 * installed; throw when extraction itself fails. The coordinator converts failures and timeouts into
 * unavailable results.</p>
 * <p><strong>Thread-safety:</strong> Different extractors are invoked concurrently; a single instance is
 * called at most once per job.</p>
 *
 * @since 0.1.0
 */
public interface StaticExtractor {
  /**
   * Identifies the concern this extractor reports on.
   *
   * @return extractor identifier
   */
  ExtractorId id();

  /**
   * Produces raw findings for the given analysis target.
   *
   * @param target decompiled package directory or extractor artifact location
   * @return present findings or an explicit unavailable marker
   * @throws IOException if the target cannot be read
   * @throws InterruptedException if interrupted while waiting on an external tool
   */
  ExtractorResult extract(Path target) throws IOException, InterruptedException;
}
