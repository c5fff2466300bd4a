package hipify.exec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CommandLineOptionSetTest
{
  @Test
  void registeredOptionsHoldValues()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.UTILITY, "verbosity", "0", "N", "Degree of status messages");
    options.add(options.TRANSFORM, "dry-run", "Write nothing");

    assertEquals("0", options.getValue("verbosity"));
    assertNull(options.getValue("dry-run"));
    options.setValue("dry-run", "1");
    assertEquals("1", options.getValue("dry-run"));
    assertEquals(options.TRANSFORM, options.getType("dry-run"));
  }

  @Test
  void unknownOptionsAreIgnored()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.setValue("nothing", "1");

    assertFalse(options.contains("nothing"));
    assertNull(options.getValue("nothing"));
    assertEquals(0, options.getType("nothing"));
  }

  @Test
  void usageIsGroupedByCategory()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.UTILITY, "verbosity", "0", "N", "Degree of status messages");
    options.add(options.ANALYSIS, "conflict-policy", "identical", "identical|overlap", "Policy");

    String usage = options.getUsage();
    assertTrue(usage.indexOf("UTILITY") < usage.indexOf("-verbosity=N"));
    assertTrue(usage.indexOf("ANALYSIS") < usage.indexOf("-conflict-policy=identical|overlap"));
    assertEquals("-verbosity=N\n    Degree of status messages\n\n",
        options.getUsage(options.UTILITY));
  }

  @Test
  void dumpCommentsOutUnsetOptions()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.UTILITY, "verbosity", "0", "N", "Degree of status messages");
    options.add(options.TRANSFORM, "dry-run", "Write nothing");

    String dump = options.dumpOptions();
    assertTrue(dump.contains("\n#dry-run\n"));
    assertTrue(dump.contains("\nverbosity=0\n"));
    assertTrue(dump.startsWith("#Option: dry-run\n"));
  }
}
