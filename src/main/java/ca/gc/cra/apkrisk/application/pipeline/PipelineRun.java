package ca.gc.cra.apkrisk.application.pipeline;

import ca.gc.cra.apkrisk.application.port.JobStatusListener;
import ca.gc.cra.apkrisk.domain.assessment.PipelineState;
import ca.gc.cra.apkrisk.domain.error.AssessmentException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the state of one assessment job and reports transitions to a {@link JobStatusListener}.
 *
 * <p>Not thread-safe; a run is owned by the thread executing the job.</p>
 *
 * @since 0.1.0
 */
public final class PipelineRun {
  private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);

  private final String jobId;
  private final JobStatusListener listener;
  private PipelineState state = PipelineState.COLLECTING;
  private Throwable failureCause;

  PipelineRun(String jobId, JobStatusListener listener) {
    this.jobId = Objects.requireNonNull(jobId, "jobId");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public String jobId() {
    return jobId;
  }

  public PipelineState state() {
    return state;
  }

  /**
   * Returns the cause recorded when the run failed.
   *
   * @return failure cause, or empty unless the run is {@link PipelineState#FAILED}
   */
  public Optional<Throwable> failureCause() {
    return Optional.ofNullable(failureCause);
  }

  /**
   * Moves the run to {@code next}.
   *
   * @param next target state
   * @throws IllegalStateException if the transition is not allowed from the current state
   */
  void advance(PipelineState next) {
    Objects.requireNonNull(next, "next");
    if (!state.successors().contains(next)) {
      throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next + " for job " + jobId);
    }
    PipelineState previous = state;
    state = next;
    log.debug("Job {} {} -> {}", jobId, previous, next);
    listener.onTransition(jobId, previous, next);
  }

  /**
   * Moves the run to {@link PipelineState#FAILED}, recording the typed cause.
   *
   * @param cause failure that aborted the job
   */
  void fail(AssessmentException cause) {
    abort(cause);
    listener.onFailure(jobId, cause);
  }

  /**
   * Moves the run to {@link PipelineState#FAILED} for an untyped cause such as interruption.
   *
   * @param cause failure that aborted the job
   */
  void abort(Throwable cause) {
    failureCause = Objects.requireNonNull(cause, "cause");
    if (!state.terminal()) {
      advance(PipelineState.FAILED);
    }
  }
}
