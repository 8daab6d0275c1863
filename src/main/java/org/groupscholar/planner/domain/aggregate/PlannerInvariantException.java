package org.groupscholar.planner.domain.aggregate;

/**
 * Raised when an aggregation stage detects that its output contradicts its input, such as a tier/status table
 * whose cells do not add up to the scored record count.
 *
 * <p>Signals a logic defect rather than bad input; callers should fail the run.</p>
 *
 * @since 0.1.0
 */
public final class PlannerInvariantException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception describing the violated invariant.
   *
   * @param message invariant description including the observed values
   */
  public PlannerInvariantException(String message) {
    super(message);
  }

  /**
   * Throws when {@code expected != actual}.
   *
   * @param what name of the checked figure
   * @param expected expected value
   * @param actual observed value
   * @throws PlannerInvariantException when the values differ
   */
  public static void requireEqual(String what, long expected, long actual) {
    if (expected != actual) {
      throw new PlannerInvariantException(what + " expected " + expected + " but was " + actual);
    }
  }
}
