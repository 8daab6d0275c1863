package org.groupscholar.planner.domain.record;

/**
 * <strong>What:</strong> Touchpoint status assigned to every scored record.
 * <p><strong>Why:</strong> Drives the status component of the priority score and every status-keyed rollup.</p>
 * <p><strong>Role:</strong> Domain value; declaration order is the column order of the tier/status table.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum TouchStatus {
  /** Days since last touch exceed the tier cadence. */
  OVERDUE("overdue", "overdue", 2),
  /** Next due date falls within the soon window. */
  DUE_SOON("due-soon", "due_soon", 1),
  /** Touched recently enough that nothing is due soon. */
  ON_TRACK("on-track", "on_track", 0),
  /** No recorded touchpoint at all. */
  NO_TOUCH("no-touch", "no_touch", 3);

  private final String label;
  private final String key;
  private final int severity;

  TouchStatus(String label, String key, int severity) {
    this.label = label;
    this.key = key;
    this.severity = severity;
  }

  /**
   * Returns the hyphenated label shown to operators, e.g. {@code due-soon}.
   *
   * @return display label
   */
  public String label() {
    return label;
  }

  /**
   * Returns the snake-case key used for structured output columns, e.g. {@code due_soon}.
   *
   * @return structured output key
   */
  public String key() {
    return key;
  }

  /**
   * Returns the severity rank; higher means more urgent. {@link #NO_TOUCH} ranks highest.
   *
   * @return severity rank
   */
  public int severity() {
    return severity;
  }

  /**
   * Indicates whether the status counts toward cadence compliance.
   *
   * @return {@code true} for {@link #ON_TRACK} and {@link #DUE_SOON}
   */
  public boolean compliant() {
    return this == ON_TRACK || this == DUE_SOON;
  }
}
