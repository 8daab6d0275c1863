package org.groupscholar.planner.infrastructure.json;

import static org.groupscholar.planner.testutil.JsonTree.array;
import static org.groupscholar.planner.testutil.JsonTree.object;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.testutil.Fixtures;
import org.groupscholar.planner.testutil.JsonTree;
import org.junit.jupiter.api.Test;

class JsonReportWriterTest {
  private final PlanReport report = Fixtures.sampleReport();

  @Test
  void writesVersionAndRunMetadata() {
    Map<String, Object> root = JsonTree.parseObject(new JsonReportWriter(false).toJson(report));

    assertEquals(JsonReportWriter.SCHEMA_VERSION, root.get("schemaVersion"));
    Map<String, Object> metadata = object(root.get("metadata"));
    assertEquals("fixture", metadata.get("source"));
    assertEquals("2024-04-01", metadata.get("today"));
    assertEquals("2024-04-01T12:00:00Z", metadata.get("generatedAt"));
    assertEquals(5, metadata.get("rowsRead"));
    assertEquals(4, metadata.get("scored"));
    assertEquals(1, metadata.get("rejected"));
    assertEquals("70", object(metadata.get("config")).get("highRisk"));
  }

  @Test
  void topLevelSectionsKeepTheirOrder() {
    Map<String, Object> root = JsonTree.parseObject(new JsonReportWriter(true).toJson(report));

    assertEquals(List.of("schemaVersion", "metadata", "summary", "tierStatus", "horizon", "forecast",
        "channelMix", "flagFrequency", "cohortHotspots", "cadenceAdherence", "cadenceGuidance", "actions",
        "ownerLoads", "ownerAlerts", "ownerHorizons", "ownerCapacity", "ownerQueues", "channelBatches",
        "escalations", "issues"), List.copyOf(root.keySet()));
  }

  @Test
  void summaryCountsEveryStatusAndTier() {
    Map<String, Object> summary = object(JsonTree.parseObject(new JsonReportWriter(false).toJson(report))
        .get("summary"));

    assertEquals(4, summary.get("total"));
    Map<String, Object> byStatus = object(summary.get("byStatus"));
    assertEquals(List.of("overdue", "due_soon", "on_track", "no_touch"), List.copyOf(byStatus.keySet()));
    assertEquals(1, byStatus.get("overdue"));
    assertEquals(1, byStatus.get("no_touch"));
    assertEquals(List.of("high", "medium", "low"), List.copyOf(object(summary.get("byTier")).keySet()));
  }

  @Test
  void actionsCarryFullRowsWithNullsForAbsentValues() {
    Map<String, Object> root = JsonTree.parseObject(new JsonReportWriter(false).toJson(report));
    List<Object> actions = array(root.get("actions"));

    assertEquals(4, actions.size());
    Map<String, Object> first = object(actions.get(0));
    assertEquals(1, first.get("rank"));
    assertEquals("S-1", first.get("id"));
    assertEquals("Morgan", first.get("owner"));
    assertEquals("high", first.get("riskTier"));
    assertEquals("overdue", first.get("status"));
    assertEquals(133.0, first.get("priorityScore"));
    assertEquals(List.of("safety"), first.get("flags"));
    assertFalse(array(first.get("reasons")).isEmpty());

    Map<String, Object> unowned = findById(actions, "S-3");
    assertTrue(unowned.containsKey("owner"));
    assertNull(unowned.get("owner"));

    Map<String, Object> neverTouched = findById(actions, "S-2");
    assertNull(neverTouched.get("lastTouchDate"));
    assertNull(neverTouched.get("dueInDays"));
    assertEquals("no_touch", neverTouched.get("status"));
  }

  @Test
  void escalationsAndIssuesAreSerialized() {
    Map<String, Object> root = JsonTree.parseObject(new JsonReportWriter(false).toJson(report));

    List<Object> escalations = array(root.get("escalations"));
    assertEquals(1, escalations.size());
    assertEquals("S-1", object(escalations.get(0)).get("id"));

    List<Object> issues = array(root.get("issues"));
    assertEquals(1, issues.size());
    Map<String, Object> issue = object(issues.get(0));
    assertEquals(4, issue.get("row"));
    assertEquals("S-4", issue.get("recordId"));
    assertEquals("MISSING_FIELD", issue.get("kind"));
    assertEquals(Boolean.TRUE, issue.get("excluded"));
  }

  @Test
  void queuesUseCompactActionReferences() {
    Map<String, Object> root = JsonTree.parseObject(new JsonReportWriter(false).toJson(report));

    Map<String, Object> queue = object(array(root.get("ownerQueues")).get(0));
    assertEquals("Morgan", queue.get("owner"));
    Map<String, Object> ref = object(array(queue.get("actions")).get(0));
    assertEquals(List.of("rank", "id", "name", "priorityScore", "status", "recommendedAction"),
        List.copyOf(ref.keySet()));
  }

  @Test
  void streamIsLeftOpenForTheCaller() throws IOException {
    ClosingTrackingStream out = new ClosingTrackingStream();

    new JsonReportWriter(false).write(report, out);

    assertFalse(out.closed);
    assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("{\"schemaVersion\":1"));
  }

  @Test
  void rendersFlatMapsInInsertionOrder() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("limit", "10");
    values.put("soonDays", "14");

    assertEquals("{\"limit\":\"10\",\"soonDays\":\"14\"}", new JsonReportWriter(false).toJson(values));
  }

  private static Map<String, Object> findById(List<Object> actions, String id) {
    return actions.stream()
        .map(JsonTree::object)
        .filter(action -> id.equals(action.get("id")))
        .findFirst()
        .orElseThrow(() -> new AssertionError("no action for " + id));
  }

  private static final class ClosingTrackingStream extends ByteArrayOutputStream {
    private boolean closed;

    @Override
    public void close() throws IOException {
      closed = true;
      super.close();
    }
  }
}
