package info.isaksson.erland.composetoflutter.core;

import info.isaksson.erland.composetoflutter.ir.SourceProject;
import info.isaksson.erland.composetoflutter.testutil.NotesSample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static info.isaksson.erland.composetoflutter.testutil.Sources.*;
import static org.junit.jupiter.api.Assertions.*;

public class ReportWriterTest {

    @TempDir
    Path tmp;

    private static ConversionReport cycleReport() {
        SourceProject p = project("loop",
                unit("A.kt", "p", List.of("p.B"), cls("A")),
                unit("B.kt", "p", List.of("p.A"), cls("B")));
        return new ConversionService().convert(p, new ConversionOptions()).report;
    }

    @Test
    void markdownListsSummaryCyclesAndWarnings() {
        String md = ReportWriter.toMarkdown(Path.of("in.json"), Path.of("out"), cycleReport());

        assertTrue(md.startsWith("# compose-to-flutter report\n"), md);
        assertTrue(md.contains("- Project: `loop`"), md);
        assertTrue(md.contains("- Success: **true**"), md);
        assertTrue(md.contains("- Units: **2**"), md);
        assertTrue(md.contains("| 1 | `"), md);
        assertTrue(md.contains("## Dependency cycles\n\n- A.kt -> B.kt -> A.kt\n"), md);
        assertTrue(md.contains("- CYCLE: Dependency cycle: A.kt -> B.kt -> A.kt"), md);
        assertTrue(md.contains("## Errors\n\n_(none)_"), md);
    }

    @Test
    void writesMarkdownFileCreatingDirectories() throws Exception {
        Path out = tmp.resolve("reports/nested/report.md");
        ReportWriter.writeMarkdown(out, null, null, cycleReport());
        String md = Files.readString(out);
        assertFalse(md.contains("- Input:"), md);
        assertTrue(md.contains("## Complexity"), md);
    }

    @Test
    void jsonReportIsDeterministic() throws Exception {
        SourceProject p = NotesSample.load();
        String first = ReportJson.toJsonString(new ConversionService().convert(p, new ConversionOptions()).report);
        String second = ReportJson.toJsonString(new ConversionService().convert(p, new ConversionOptions()).report);

        assertEquals(first, second);
        assertTrue(first.endsWith("}\n"));
        assertTrue(first.indexOf("\"projectName\"") < first.indexOf("\"success\""), first);
        assertTrue(first.contains("\"success\" : true"), first);
        assertTrue(first.contains("\"targetPath\" : \"ui/notes_screen.dart\""), first);
        assertFalse(first.contains("\"code\" : \"import"), "report carries no generated code");
    }

    @Test
    void jsonReportWritesFile() throws Exception {
        Path out = tmp.resolve("r/report.json");
        ReportJson.write(cycleReport(), out);
        String s = Files.readString(out);
        assertTrue(s.contains("\"cycles\""), s);
        assertTrue(s.contains("\"CYCLE\""), s);
        assertThrows(IllegalArgumentException.class, () -> ReportJson.toJsonString(null));
    }
}
