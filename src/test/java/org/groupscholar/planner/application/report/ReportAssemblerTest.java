package org.groupscholar.planner.application.report;

import static org.groupscholar.planner.testutil.Fixtures.TODAY;
import static org.groupscholar.planner.testutil.Fixtures.ranked;
import static org.groupscholar.planner.testutil.Fixtures.withDueIn;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.groupscholar.planner.application.aggregate.HorizonForecastBucketer;
import org.groupscholar.planner.application.aggregate.PortfolioSummarizer;
import org.groupscholar.planner.application.aggregate.TierStatusAggregator;
import org.groupscholar.planner.config.PlannerConfig;
import org.groupscholar.planner.domain.aggregate.PlannerInvariantException;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.junit.jupiter.api.Test;

class ReportAssemblerTest {
  private final HorizonForecastBucketer bucketer = new HorizonForecastBucketer();
  private final PortfolioSummarizer summarizer = new PortfolioSummarizer(PlannerConfig.defaults());

  private final List<ScoredRecord> scored = List.of(
      withDueIn("1", "A", -1, 90),
      withDueIn("2", "A", 3, 70),
      withDueIn("3", "B", null, 80));

  private ReportAssembler complete(RunMetadata metadata, List<ScoredRecord> sectionInput, List<Action> actions) {
    return ReportAssembler.forRun(metadata)
        .actions(actions)
        .tierStatus(new TierStatusAggregator().aggregate(sectionInput))
        .horizon(bucketer.horizon(sectionInput))
        .forecast(bucketer.forecast(sectionInput, TODAY, 7, false))
        .summary(summarizer.summary(sectionInput, metadata.rejectedCount()))
        .cadenceAdherence(summarizer.cadenceAdherence(sectionInput));
  }

  private static RunMetadata metadata(int rowsRead, int scored, int rejected) {
    return new RunMetadata("test", TODAY, Instant.EPOCH, Map.of(), rowsRead, scored, rejected);
  }

  @Test
  void assemblesConsistentSections() {
    List<Action> actions = ranked(scored);

    PlanReport report = complete(metadata(4, 3, 1), scored, actions).escalations(actions.subList(0, 1)).assemble();

    assertEquals(3, report.actions().size());
    assertEquals(2, report.topActions(2).size());
    assertEquals(3, report.topActions(10).size());
    assertTrue(report.ownerAlerts().isEmpty());
  }

  @Test
  void rejectsRowCountMismatch() {
    assertThrows(PlannerInvariantException.class,
        () -> complete(metadata(5, 3, 1), scored, ranked(scored)).assemble());
  }

  @Test
  void rejectsSectionsBuiltFromDifferentRecords() {
    List<ScoredRecord> fewer = scored.subList(0, 2);

    assertThrows(PlannerInvariantException.class,
        () -> complete(metadata(3, 3, 0), fewer, ranked(scored)).assemble());
  }

  @Test
  void rejectsEscalationOutsideActions() {
    List<Action> foreign = ranked(List.of(withDueIn("zzz", "A", -5, 200)));

    assertThrows(PlannerInvariantException.class,
        () -> complete(metadata(3, 3, 0), scored, ranked(scored)).escalations(foreign).assemble());
  }

  @Test
  void requiresCoreSections() {
    assertThrows(NullPointerException.class,
        () -> ReportAssembler.forRun(metadata(0, 0, 0)).assemble());
  }
}
