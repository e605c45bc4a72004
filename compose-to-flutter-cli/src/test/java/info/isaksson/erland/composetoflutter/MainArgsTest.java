package info.isaksson.erland.composetoflutter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainArgsTest {

    @TempDir
    Path tmp;

    @Test
    void parsesFlags() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "in.json", "--output", "out", "--complexity-threshold", "12", "--fail-on-error", "yes", "--threads", "2"
        });
        assertEquals("in.json", a.input);
        assertEquals("out", a.output);
        assertEquals(12, a.complexityThreshold);
        assertTrue(a.failOnError);
        assertEquals(2, a.threads);
        assertNull(a.report);
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--output"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--output", "--input"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a.json", "b.json"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--fail-on-error", "maybe"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--threads", "0"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--complexity-threshold", "x"}));
    }

    @Test
    void exitCodes() throws Exception {
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--bogus"}));
        assertEquals(1, Main.run(new String[] {"--input", tmp.resolve("missing.json").toString()}));

        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{ \"units\": [ ");
        assertEquals(2, Main.run(new String[] {"--input", broken.toString(), "--output", tmp.resolve("o").toString()}));

        Path missingConfig = tmp.resolve("nope.json");
        assertEquals(2, Main.run(new String[] {
                "--input", TestRepoPaths.resolveNotesProject().toString(),
                "--output", tmp.resolve("o2").toString(),
                "--config", missingConfig.toString()
        }));
    }

    @Test
    void reportJsonSitsNextToMarkdown() {
        assertEquals(Path.of("/r/report.json"), Main.jsonSibling(Path.of("/r/report.md")));
        assertEquals(Path.of("/r/summary.json"), Main.jsonSibling(Path.of("/r/summary")));
    }
}
