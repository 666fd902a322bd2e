package ca.gc.cra.apkrisk.application.port;

import ca.gc.cra.apkrisk.domain.assessment.PipelineState;
import ca.gc.cra.apkrisk.domain.error.AssessmentException;

/**
 * Port notified as an assessment job moves through its lifecycle.
 *
 * <p>Persistence and job tracking live outside the engine; they observe progress through this port.</p>
 *
 * @since 0.1.0
 */
public interface JobStatusListener {
  /**
   * Called after every successful state transition.
   *
   * @param jobId job identifier
   * @param from previous state
   * @param to new state
   */
  void onTransition(String jobId, PipelineState from, PipelineState to);

  /**
   * Called once when a job enters {@link PipelineState#FAILED}.
   *
   * @param jobId job identifier
   * @param cause typed failure that aborted the job
   */
  default void onFailure(String jobId, AssessmentException cause) {}

  /** Listener that ignores all notifications. */
  JobStatusListener NO_OP = (jobId, from, to) -> {};
}
