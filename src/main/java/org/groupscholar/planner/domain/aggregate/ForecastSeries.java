package org.groupscholar.planner.domain.aggregate;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Day-by-day outreach volume over the forecast window.
 * <p><strong>Invariant:</strong> {@code sum(daily) == inWindow + (includesOverdue ? overdue : 0)}; no record is
 * counted on two days.</p>
 *
 * @param startDate date of day 0 (run "today")
 * @param windowDays number of forecast days
 * @param includesOverdue whether overdue records were folded into day 0
 * @param daily one entry per day offset in {@code [0, windowDays)}
 * @param inWindow records whose due date falls inside the window
 * @param overdue records already overdue
 * @param beyondWindow records due after the window
 * @param noDueDate records with no due date
 * @since 0.1.0
 */
public record ForecastSeries(
    LocalDate startDate,
    int windowDays,
    boolean includesOverdue,
    List<Day> daily,
    int inWindow,
    int overdue,
    int beyondWindow,
    int noDueDate) {

  public ForecastSeries {
    Objects.requireNonNull(startDate, "startDate");
    daily = List.copyOf(Objects.requireNonNull(daily, "daily"));
    if (daily.size() != windowDays) {
      throw new IllegalArgumentException("daily must contain " + windowDays + " entries");
    }
  }

  /**
   * Returns the sum of all daily counts.
   *
   * @return forecast volume
   */
  public int total() {
    return daily.stream().mapToInt(Day::count).sum();
  }

  /**
   * One forecast day.
   *
   * @param offset days after {@link #startDate()}
   * @param date calendar date
   * @param count touches due that day
   */
  public record Day(int offset, LocalDate date, int count) {
    public Day {
      Objects.requireNonNull(date, "date");
    }
  }
}
