package org.replaymem.cli;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CommandLineInterfaceTest {

    @Test
    public void testCliInitialization() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        assertEquals("replaymem", cmd.getCommandName());
        assertTrue(cmd.getSubcommands().containsKey("bench"));
    }

    @Test
    public void testNoSubcommandPrintsUsage() {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new CommandLineInterface(ConfigFactory.empty()));
        cmd.setOut(new PrintWriter(out));

        assertEquals(0, cmd.execute());
        assertTrue(out.toString().contains("bench"));
    }
}
