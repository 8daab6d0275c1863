package org.groupscholar.planner.infrastructure.console;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.groupscholar.planner.application.port.ReportOutputPort;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.domain.aggregate.AlertReason;
import org.groupscholar.planner.domain.aggregate.ChannelBatch;
import org.groupscholar.planner.domain.aggregate.CohortHotspot;
import org.groupscholar.planner.domain.aggregate.ForecastSeries;
import org.groupscholar.planner.domain.aggregate.HorizonBucket;
import org.groupscholar.planner.domain.aggregate.HorizonBuckets;
import org.groupscholar.planner.domain.aggregate.OwnerAlert;
import org.groupscholar.planner.domain.aggregate.OwnerLoadSummary;
import org.groupscholar.planner.domain.aggregate.PortfolioSummary;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.RiskTier;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.domain.record.TouchStatus;

/**
 * <strong>What:</strong> Prints the report as fixed-width text sections.
 * <p><strong>Sections:</strong> summary, channel mix, high-impact flags, cohort hotspots, owner load, owner alerts,
 * priority action queue, escalations, channel batches, forecast and cadence guidance. Empty sections print a
 * one-line placeholder instead of a table.</p>
 * <p><strong>Limits:</strong> The action queue shows the first {@code limit} actions and the owner load table the
 * first {@code ownerLimit} owners; every other section is already bounded by the engine.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleReportAdapter implements ReportOutputPort {
  private final Consumer<String> out;
  private final int limit;
  private final int ownerLimit;
  private final boolean explain;

  /**
   * Creates a console adapter.
   *
   * @param out line sink, such as a CLI printer
   * @param limit actions shown in the queue
   * @param ownerLimit owners shown in the load table
   * @param explain whether to print score reasons under each action
   */
  public ConsoleReportAdapter(Consumer<String> out, int limit, int ownerLimit, boolean explain) {
    this.out = Objects.requireNonNull(out, "out");
    this.limit = limit;
    this.ownerLimit = ownerLimit;
    this.explain = explain;
  }

  @Override
  public void write(PlanReport report) {
    Objects.requireNonNull(report, "report");
    printSummary(report.summary(), report.horizon());
    printCounts("Channel Mix", "No channel data available.", report.channelMix(), 10);
    printCounts("High-Impact Flags", "No high-impact flags captured.", report.flagFrequency(), 12);
    printCohorts(report.cohortHotspots());
    printOwnerLoads(report.ownerLoads());
    printOwnerAlerts(report.ownerAlerts());
    printActions("Priority Action Queue", report.topActions(limit), "No records to plan.");
    printActions("Escalations", report.escalations(), "No escalations.");
    printChannelBatches(report.channelBatches());
    printForecast(report.forecast());
    heading("Cadence Guidance");
    report.cadenceGuidance().forEach(out);
    if (!report.issues().isEmpty()) {
      out.accept("");
      out.accept(report.issues().size() + " data issue(s); "
          + report.metadata().rejectedCount() + " row(s) excluded. See the JSON report for details.");
    }
  }

  private void printSummary(PortfolioSummary summary, HorizonBuckets horizon) {
    heading("Intervention Summary");
    out.accept("Total scholars: " + summary.total());
    for (RiskTier tier : RiskTier.values()) {
      out.accept(tier.displayName() + " risk: " + summary.byTier().get(tier));
    }
    out.accept("Overdue touches: " + summary.byStatus().get(TouchStatus.OVERDUE));
    out.accept("Due soon: " + summary.byStatus().get(TouchStatus.DUE_SOON));
    out.accept("On track: " + summary.byStatus().get(TouchStatus.ON_TRACK));
    out.accept("No prior touch: " + summary.byStatus().get(TouchStatus.NO_TOUCH));
    out.accept("Stale (no touch in stale window): " + summary.stale());
    if (summary.futureDated() > 0) {
      out.accept("Future-dated touches treated as today: " + summary.futureDated());
    }
    String buckets = Arrays.stream(HorizonBucket.values())
        .map(bucket -> bucket.key() + "=" + horizon.count(bucket))
        .collect(Collectors.joining(", "));
    out.accept("Horizon: overdue=" + horizon.overdue() + ", " + buckets + ", no_due_date=" + horizon.noDueDate());
  }

  private void printCounts(String title, String empty, Map<String, Integer> counts, int width) {
    heading(title);
    if (counts.isEmpty()) {
      out.accept(empty);
      return;
    }
    counts.forEach((key, count) -> out.accept(String.format(Locale.ROOT, "%-" + width + "s %d", key, count)));
  }

  private void printCohorts(List<CohortHotspot> hotspots) {
    heading("Cohort Hotspots");
    if (hotspots.isEmpty()) {
      out.accept("No cohort data available.");
      return;
    }
    table(String.format(Locale.ROOT, "%-16s %5s %7s %7s %7s %9s",
        "Cohort", "Total", "Overdue", "DueSoon", "NoTouch", "AvgScore"));
    for (CohortHotspot hotspot : hotspots) {
      out.accept(String.format(Locale.ROOT, "%-16s %5d %7d %7d %7d %9.1f",
          clip(hotspot.cohort(), 16), hotspot.total(), hotspot.overdue(), hotspot.dueSoon(), hotspot.noTouch(),
          hotspot.avgPriority()));
    }
  }

  private void printOwnerLoads(List<OwnerLoadSummary> loads) {
    heading("Owner Load");
    if (loads.isEmpty()) {
      out.accept("No owner data available.");
      return;
    }
    table(String.format(Locale.ROOT, "%-16s %5s %7s %7s %7s %6s %9s %8s",
        "Owner", "Total", "Overdue", "DueSoon", "NoTouch", "High", "AvgScore", "Capacity"));
    for (OwnerLoadSummary load : loads.subList(0, Math.min(ownerLimit, loads.size()))) {
      out.accept(String.format(Locale.ROOT, "%-16s %5d %7d %7d %7d %6d %9.1f %8.2f",
          clip(load.owner(), 16), load.total(), load.overdue(), load.dueSoon(), load.noTouch(), load.highRisk(),
          load.avgPriority(), load.capacityRatio()));
    }
  }

  private void printOwnerAlerts(List<OwnerAlert> alerts) {
    heading("Owner Alerts");
    if (alerts.isEmpty()) {
      out.accept("No owner alerts.");
      return;
    }
    for (OwnerAlert alert : alerts) {
      String reasons = alert.reasons().stream().map(AlertReason::key).collect(Collectors.joining(", "));
      out.accept(String.format(Locale.ROOT, "%-16s overdue=%d no_touch=%d total=%d [%s]",
          clip(alert.owner(), 16), alert.overdue(), alert.noTouch(), alert.total(), reasons));
    }
  }

  private void printActions(String title, List<Action> actions, String empty) {
    heading(title);
    if (actions.isEmpty()) {
      out.accept(empty);
      return;
    }
    table(String.format(Locale.ROOT, "%4s %6s  %-20s %-10s %5s  %-9s %-10s",
        "#", "Score", "Scholar", "Cohort", "Risk", "Status", "Due"));
    for (Action action : actions) {
      ScoredRecord scored = action.scored();
      String due = scored.assessment().nextDueDate().map(Object::toString).orElse("-");
      out.accept(String.format(Locale.ROOT, "%4d %6.1f  %-20s %-10s %5d  %-9s %-10s",
          action.rank(), scored.priorityScore(), clip(scored.record().name(), 20),
          clip(scored.record().cohort(), 10), scored.record().riskScore(), scored.status().label(), due));
      out.accept("      -> " + scored.recommendedAction());
      if (explain) {
        for (String reason : scored.priorityReasons()) {
          out.accept("         * " + reason);
        }
      }
    }
  }

  private void printChannelBatches(List<ChannelBatch> batches) {
    heading("Channel Batches");
    if (batches.isEmpty()) {
      out.accept("No channel batches.");
      return;
    }
    for (ChannelBatch batch : batches) {
      out.accept(batch.channel() + " (" + batch.count() + " in pool)");
      for (Action action : batch.actions()) {
        out.accept(String.format(Locale.ROOT, "  %4d %6.1f  %s",
            action.rank(), action.priorityScore(), action.scored().record().name()));
      }
    }
  }

  private void printForecast(ForecastSeries forecast) {
    heading("Touchpoint Forecast");
    out.accept(String.format(Locale.ROOT, "Window: %d days from %s (overdue %s day 0)",
        forecast.windowDays(), forecast.startDate(), forecast.includesOverdue() ? "folded into" : "excluded from"));
    for (ForecastSeries.Day day : forecast.daily()) {
      if (day.count() > 0) {
        out.accept(String.format(Locale.ROOT, "%s %3d", day.date(), day.count()));
      }
    }
    out.accept(String.format(Locale.ROOT, "Overdue: %d  Beyond window: %d  No due date: %d",
        forecast.overdue(), forecast.beyondWindow(), forecast.noDueDate()));
  }

  private void heading(String title) {
    out.accept("");
    out.accept(title);
    out.accept("-".repeat(title.length()));
  }

  private void table(String header) {
    out.accept(header);
    out.accept("-".repeat(header.length()));
  }

  private static String clip(String value, int width) {
    return value.length() <= width ? value : value.substring(0, width);
  }
}
