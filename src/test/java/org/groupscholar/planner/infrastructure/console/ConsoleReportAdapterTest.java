package org.groupscholar.planner.infrastructure.console;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.groupscholar.planner.application.pipeline.PlannerEngine;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.testutil.Fixtures;
import org.junit.jupiter.api.Test;

class ConsoleReportAdapterTest {
  private final List<String> lines = new ArrayList<>();

  @Test
  void printsEverySectionHeading() {
    new ConsoleReportAdapter(lines::add, 10, 5, false).write(Fixtures.sampleReport());

    for (String heading : List.of("Intervention Summary", "Channel Mix", "High-Impact Flags", "Cohort Hotspots",
        "Owner Load", "Owner Alerts", "Priority Action Queue", "Escalations", "Channel Batches",
        "Touchpoint Forecast", "Cadence Guidance")) {
      int index = lines.indexOf(heading);
      assertTrue(index >= 0, "missing heading " + heading);
      assertEquals("-".repeat(heading.length()), lines.get(index + 1));
    }
    assertTrue(lines.contains("Total scholars: 4"));
    assertTrue(lines.contains("High risk: touch every 7 days"));
    assertTrue(lines.contains("1 data issue(s); 1 row(s) excluded. See the JSON report for details."));
  }

  @Test
  void queueHonoursLimitAndExplainFlag() {
    new ConsoleReportAdapter(lines::add, 1, 5, true).write(Fixtures.sampleReport());

    int queue = lines.indexOf("Priority Action Queue");
    int escalations = lines.indexOf("Escalations");
    List<String> queueLines = lines.subList(queue, escalations);
    long rows = queueLines.stream().filter(line -> line.startsWith("      -> ")).count();
    assertEquals(1, rows);
    assertTrue(queueLines.stream().anyMatch(line -> line.contains("Avery")));
    assertTrue(queueLines.stream().anyMatch(line -> line.startsWith("         * ")));
  }

  @Test
  void reasonsAreHiddenWithoutExplain() {
    new ConsoleReportAdapter(lines::add, 10, 5, false).write(Fixtures.sampleReport());

    assertFalse(lines.stream().anyMatch(line -> line.startsWith("         * ")));
  }

  @Test
  void emptyRunPrintsPlaceholders() {
    PlanReport empty = new PlannerEngine().run(
        List.of(), "empty", PlannerConfig.defaults(), Fixtures.SAMPLE_TODAY, Fixtures.SAMPLE_GENERATED);

    new ConsoleReportAdapter(lines::add, 10, 5, false).write(empty);

    assertTrue(lines.contains("Total scholars: 0"));
    assertTrue(lines.contains("No channel data available."));
    assertTrue(lines.contains("No cohort data available."));
    assertTrue(lines.contains("No owner data available."));
    assertTrue(lines.contains("No records to plan."));
    assertTrue(lines.contains("No escalations."));
    assertTrue(lines.contains("No channel batches."));
    assertFalse(lines.stream().anyMatch(line -> line.contains("data issue(s)")));
  }
}
