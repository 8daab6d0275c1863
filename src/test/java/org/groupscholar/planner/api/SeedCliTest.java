package org.groupscholar.planner.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.UUID;
import org.groupscholar.planner.config.DatabaseSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SeedCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private String url;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    url = "jdbc:h2:mem:seed-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
    PlannerCliSupport.setDatabaseForTesting(new DatabaseSettings(url, Optional.empty(), Optional.empty()));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    PlannerCliSupport.clearDatabaseForTesting();
  }

  @Test
  void seedsSampleRunWithoutPrintingReport() throws IOException, SQLException {
    ExitCode code = SeedCli.run(new String[] {"in=" + fixture(), "today=2024-04-01", "dbSchema=seed_demo"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Seeded sample data into schema 'seed_demo'."));
    assertFalse(output.contains("Intervention Summary"));
    try (Connection connection = DriverManager.getConnection(url);
        Statement statement = connection.createStatement();
        ResultSet rs = statement.executeQuery("SELECT run_label, config FROM seed_demo.planner_runs")) {
      assertTrue(rs.next());
      assertEquals("outreach-2024-04-01", rs.getString("run_label"));
      assertTrue(rs.getString("config").contains("\"forecastIncludeOverdue\":\"true\""));
    }
  }

  @Test
  void rejectsScoringOverrides() throws IOException {
    ExitCode code = SeedCli.run(new String[] {"in=" + fixture(), "highRisk=80"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: seed"));
  }

  @Test
  void dryRunIsNotSupported() throws IOException {
    ExitCode code = SeedCli.run(new String[] {"in=" + fixture(), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void missingSampleFileReturnsInvalidArgs() {
    ExitCode code = SeedCli.run(new String[] {"in=" + tempDir.resolve("absent.csv")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void helpDescribesSeedSettings() {
    ExitCode code = SeedCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Intervention planner: seed"));
  }

  private Path fixture() throws IOException {
    Path csv = tempDir.resolve("outreach.csv");
    if (!Files.exists(csv)) {
      try (InputStream in = getClass().getResourceAsStream("/fixtures/outreach.csv")) {
        Files.copy(in, csv);
      }
    }
    return csv;
  }
}
