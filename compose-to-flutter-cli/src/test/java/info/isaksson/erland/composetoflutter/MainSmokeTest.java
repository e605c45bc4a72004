package info.isaksson.erland.composetoflutter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @TempDir
    Path tmp;

    @Test
    void convertsNotesSampleAndWritesReports() throws IOException {
        Path outDir = tmp.resolve("out");

        int code = Main.run(new String[] {
                "--input", TestRepoPaths.resolveNotesProject().toString(),
                "--output", outDir.toString(),
                "--fail-on-error", "true"
        });
        assertEquals(0, code);

        Path screen = outDir.resolve("ui/notes_screen.dart");
        assertTrue(Files.exists(screen), "screen must be written: " + screen);
        String dart = Files.readString(screen);
        assertTrue(dart.contains("import 'package:flutter/material.dart';"), dart);
        assertTrue(dart.contains("class NotesScreen"), dart);
        assertTrue(Files.exists(outDir.resolve("model/note.dart")));
        assertTrue(Files.exists(outDir.resolve("ui/note_card.dart")));

        String md = Files.readString(outDir.resolve("report.md"));
        assertTrue(md.startsWith("# compose-to-flutter report"), md);
        String json = Files.readString(outDir.resolve("report.json"));
        assertTrue(json.contains("\"success\" : true"), json);
    }

    @Test
    void writesTreeDumpAndCustomReportPath() throws IOException {
        Path outDir = tmp.resolve("out");
        Path report = tmp.resolve("reports/conversion.md");
        Path trees = tmp.resolve("trees");

        int code = Main.run(new String[] {
                TestRepoPaths.resolveNotesProject().toString(),
                "--output", outDir.toString(),
                "--report", report.toString(),
                "--write-tree", trees.toString(),
                "--threads", "3",
                "--no-source-comments"
        });
        assertEquals(0, code);
        assertTrue(Files.exists(report));
        assertTrue(Files.exists(tmp.resolve("reports/conversion.json")));

        String dump = Files.readString(trees.resolve("ui-trees.json"));
        assertTrue(dump.contains("NotesScreen"), dump);
        assertFalse(Files.readString(outDir.resolve("model/note.dart")).contains("// Converted from"));
    }

    @Test
    void configFileIsApplied() throws IOException {
        Path config = tmp.resolve("options.json");
        Files.writeString(config, "{ \"sourceComments\": false, \"complexityThreshold\": 99 }");
        Path outDir = tmp.resolve("out");

        int code = Main.run(new String[] {
                "--input", TestRepoPaths.resolveNotesProject().toString(),
                "--output", outDir.toString(),
                "--config", config.toString(),
                "--complexity-threshold", "5"
        });
        assertEquals(0, code);
        assertFalse(Files.readString(outDir.resolve("ui/note_card.dart")).startsWith("// Converted from"));
    }
}
