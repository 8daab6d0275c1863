package org.groupscholar.planner.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void mergesCommonAndModeSections() throws Exception {
    Path file = tempDir.resolve("planner.yaml");
    Files.writeString(file, """
        common:
          highRisk: 75
          highImpactFlags: [crisis, housing]
          cadence:
            high: 5
        plan:
          highRisk: 80
          limit: 3
        seed:
          in: other.csv
        """);

    Map<String, String> plan = YamlConfigLoader.load(file, "plan").orElseThrow();

    assertEquals("80", plan.get("highRisk"));
    assertEquals("3", plan.get("limit"));
    assertEquals("crisis,housing", plan.get("highImpactFlags"));
    assertEquals("5", plan.get("cadence.high"));
    assertFalse(plan.containsKey("in"));
    assertEquals("other.csv", YamlConfigLoader.load(file, "SEED").orElseThrow().get("in"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "plan"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertTrue(YamlConfigLoader.load(file, "plan").orElseThrow().isEmpty());
  }

  @Test
  void malformedYamlIsRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("bad.yaml"), "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "plan"));
  }

  @Test
  void nonMappingSectionIsRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("list.yaml"), "plan:\n  - a\n  - b\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "plan"));
  }

  @Test
  void unknownSectionIsRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("typo.yaml"), "plann:\n  limit: 3\n");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "plan"));
    assertTrue(ex.getMessage().contains("plann"));
  }

  @Test
  void duplicateKeysAreRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("dup.yaml"), "plan:\n  limit: 3\n  limit: 4\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "plan"));
  }

  @Test
  void unsupportedCommandIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(tempDir.resolve("any.yaml"), "common"));
  }

  @Test
  void shippedSampleConfigLoads() throws Exception {
    Path sample = Path.of("config", "planner.yaml");

    Map<String, String> seed = YamlConfigLoader.load(sample, "seed").orElseThrow();

    assertEquals("true", seed.get("forecastIncludeOverdue"));
    assertEquals("intervention_planner", seed.get("dbSchema"));
    PlannerConfig.fromMap(seed);
  }
}
