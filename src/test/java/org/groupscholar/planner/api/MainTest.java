package org.groupscholar.planner.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noArgumentsPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: planner <plan|seed>"));
  }

  @Test
  void globalHelpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("plan    Score an outreach CSV"));
  }

  @Test
  void helpBeforeCommandShowsDispatcherHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help", "plan"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void helpAfterCommandIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"plan", "--help"}));
    assertTrue(buffer.toString().contains("Intervention planner: plan"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"report"}));
    assertTrue(buffer.toString().contains("usage: planner"));
  }

  @Test
  void commandArgumentsReachTheCommand() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"PLAN", "today=2024-04-01"}));
    assertTrue(buffer.toString().contains("usage: plan in=PATH"));
  }
}
