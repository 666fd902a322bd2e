package ca.gc.cra.apkrisk.application.port;

import ca.gc.cra.apkrisk.domain.feature.FeatureAvailability;

/**
 * Port that reports which optional capabilities are installed.
 *
 * <p>Probed once at pipeline start; the result is threaded through every stage of the job.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FeatureProbe {
  /**
   * Detects available optional capabilities.
   *
   * @return snapshot of installed capabilities
   */
  FeatureAvailability probe();

  /** Probe that reports every capability as installed. */
  FeatureProbe ALL_AVAILABLE = FeatureAvailability::allAvailable;
}
