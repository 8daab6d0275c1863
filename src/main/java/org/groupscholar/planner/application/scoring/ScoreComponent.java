package org.groupscholar.planner.application.scoring;

import java.util.Optional;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.TouchAssessment;

/**
 * One additive term of the priority score.
 *
 * <p>The scorer sums {@link #points} over an ordered table of components, then, in explain mode, walks the same
 * table a second time and asks each non-zero component for its {@link #reason}. Score and explanation therefore
 * come from the same rules.</p>
 *
 * @since 0.1.0
 */
public interface ScoreComponent {

  /**
   * Short stable name used in logs.
   *
   * @return component name
   */
  String name();

  /**
   * Returns the non-negative contribution of this component.
   *
   * @param record normalized record
   * @param assessment classifier output
   * @return points, {@code >= 0}
   */
  double points(NormalizedRecord record, TouchAssessment assessment);

  /**
   * Explains a non-zero contribution.
   *
   * @param record normalized record
   * @param assessment classifier output
   * @param points value returned by {@link #points} for the same inputs
   * @return human-readable reason, or empty when the component has nothing to add
   */
  Optional<String> reason(NormalizedRecord record, TouchAssessment assessment, double points);
}
