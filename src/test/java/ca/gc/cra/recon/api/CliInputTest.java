package ca.gc.cra.recon.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void splitsCommandFlagsAndArguments() {
    CliInput input = CliInput.parse(new String[] {"TOP", "field=port:open", "--weighted", "-v"});
    assertEquals("top", input.command());
    assertArrayEquals(new String[] {"field=port:open"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--WEIGHTED"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void emptyArgumentsHaveNoCommand() {
    CliInput input = CliInput.parse(new String[0]);
    assertNull(input.command());
    assertEquals(0, input.keyValueArgs().length);
    assertTrue(CliInput.parse(new String[] {"--help"}).help());
  }
}
