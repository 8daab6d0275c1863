package org.groupscholar.planner.application.aggregate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import org.groupscholar.planner.domain.aggregate.ForecastSeries;
import org.groupscholar.planner.domain.aggregate.HorizonBucket;
import org.groupscholar.planner.domain.aggregate.HorizonBuckets;
import org.groupscholar.planner.domain.aggregate.PlannerInvariantException;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Buckets upcoming due dates into day ranges and builds the per-day outreach forecast.
 * <p><strong>Placement:</strong> A record with {@code dueInDays >= 0} lands in exactly one horizon bucket and, when
 * inside the window, on exactly one forecast day. Overdue and undated records are counted beside the buckets;
 * overdue records join forecast day 0 only when requested.</p>
 *
 * @since 0.1.0
 */
public final class HorizonForecastBucketer {
  private static final Logger log = LoggerFactory.getLogger(HorizonForecastBucketer.class);

  /**
   * Buckets records by days until due.
   *
   * @param scored scored records
   * @return bucket counts with overdue and undated counts
   * @throws PlannerInvariantException when the counts do not cover every record
   */
  public HorizonBuckets horizon(List<ScoredRecord> scored) {
    Objects.requireNonNull(scored, "scored");
    Map<HorizonBucket, Integer> counts = new EnumMap<>(HorizonBucket.class);
    int overdue = 0;
    int noDueDate = 0;
    for (ScoredRecord record : scored) {
      OptionalInt dueIn = record.dueInDays();
      if (dueIn.isEmpty()) {
        noDueDate++;
      } else if (dueIn.getAsInt() < 0) {
        overdue++;
      } else {
        counts.merge(HorizonBucket.forDueInDays(dueIn.getAsInt()), 1, Integer::sum);
      }
    }
    HorizonBuckets buckets = new HorizonBuckets(counts, overdue, noDueDate);
    PlannerInvariantException.requireEqual("horizon total", scored.size(), buckets.total());
    return buckets;
  }

  /**
   * Builds the daily forecast.
   *
   * @param scored scored records
   * @param today day 0
   * @param windowDays number of days, {@code >= 1}
   * @param includeOverdue whether overdue records are added to day 0
   * @return forecast series
   * @throws PlannerInvariantException when the daily total disagrees with the in-window count
   */
  public ForecastSeries forecast(
      List<ScoredRecord> scored, LocalDate today, int windowDays, boolean includeOverdue) {
    Objects.requireNonNull(scored, "scored");
    Objects.requireNonNull(today, "today");
    if (windowDays < 1) {
      throw new IllegalArgumentException("windowDays must be >= 1 (was " + windowDays + ")");
    }
    int[] daily = new int[windowDays];
    int inWindow = 0;
    int overdue = 0;
    int beyond = 0;
    int noDueDate = 0;
    for (ScoredRecord record : scored) {
      OptionalInt dueIn = record.dueInDays();
      if (dueIn.isEmpty()) {
        noDueDate++;
        continue;
      }
      int days = dueIn.getAsInt();
      if (days < 0) {
        overdue++;
        if (includeOverdue) {
          daily[0]++;
        }
      } else if (days < windowDays) {
        inWindow++;
        daily[days]++;
      } else {
        beyond++;
      }
    }
    List<ForecastSeries.Day> days = new ArrayList<>(windowDays);
    for (int offset = 0; offset < windowDays; offset++) {
      days.add(new ForecastSeries.Day(offset, today.plusDays(offset), daily[offset]));
    }
    ForecastSeries series =
        new ForecastSeries(today, windowDays, includeOverdue, days, inWindow, overdue, beyond, noDueDate);
    PlannerInvariantException.requireEqual(
        "forecast total", inWindow + (includeOverdue ? overdue : 0), series.total());
    PlannerInvariantException.requireEqual(
        "forecast coverage", scored.size(), inWindow + overdue + beyond + noDueDate);
    log.debug("Forecast over {} days: {} in window, {} overdue, {} beyond, {} undated",
        windowDays, inWindow, overdue, beyond, noDueDate);
    return series;
  }
}
