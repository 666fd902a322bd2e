package ca.gc.cra.apkrisk.domain.assessment;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single assessment job.
 *
 * <p>Legal paths are {@code COLLECTING -> NORMALIZING -> SCORING -> DONE}; any non-terminal state may
 * move to {@code FAILED}. {@code DONE} and {@code FAILED} are terminal.</p>
 *
 * @since 0.1.0
 */
public enum PipelineState {
  COLLECTING,
  NORMALIZING,
  SCORING,
  DONE,
  FAILED;

  /**
   * Returns the states reachable from this one in a single step.
   *
   * @return successor states; empty for terminal states
   */
  public Set<PipelineState> successors() {
    return switch (this) {
      case COLLECTING -> EnumSet.of(NORMALIZING, FAILED);
      case NORMALIZING -> EnumSet.of(SCORING, FAILED);
      case SCORING -> EnumSet.of(DONE, FAILED);
      case DONE, FAILED -> EnumSet.noneOf(PipelineState.class);
    };
  }

  /**
   * Indicates whether the job can no longer change state.
   *
   * @return {@code true} for {@link #DONE} and {@link #FAILED}
   */
  public boolean terminal() {
    return this == DONE || this == FAILED;
  }
}
