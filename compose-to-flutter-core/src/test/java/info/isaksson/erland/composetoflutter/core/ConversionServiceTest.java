package info.isaksson.erland.composetoflutter.core;

import info.isaksson.erland.composetoflutter.emitter.ComponentShape;
import info.isaksson.erland.composetoflutter.emitter.GenerationWarning;
import info.isaksson.erland.composetoflutter.emitter.GenerationWarnings;
import info.isaksson.erland.composetoflutter.ir.SourceParameter;
import info.isaksson.erland.composetoflutter.ir.SourceProject;
import info.isaksson.erland.composetoflutter.testutil.NotesSample;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static info.isaksson.erland.composetoflutter.testutil.Sources.*;
import static info.isaksson.erland.composetoflutter.testutil.NotesSample.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConversionServiceTest {

    private static SourceProject chain() {
        return project("a",
                unit("A.kt", "p", List.of("p.B"), cls("A")),
                unit("B.kt", "p", List.of(), cls("B")));
    }

    private static SourceProject cycle() {
        return project("b",
                unit("A.kt", "p", List.of("p.B"), cls("A")),
                unit("B.kt", "p", List.of("p.C"), cls("B")),
                unit("C.kt", "p", List.of("p.A"), cls("C")));
    }

    private static List<String> paths(ConversionResult r) {
        List<String> out = new ArrayList<>();
        for (UnitOutput o : r.outputs) out.add(o.unitPath);
        return out;
    }

    @Test
    void importedUnitConvertsFirstAndIsImported() {
        ConversionResult r = new ConversionService().convert(chain(), new ConversionOptions());

        assertEquals(List.of("B.kt", "A.kt"), paths(r));
        assertTrue(r.report.success);
        assertTrue(r.report.cycles.isEmpty());

        UnitOutput a = r.output("A.kt");
        assertEquals("a.dart", a.targetPath);
        assertEquals("a.dart", a.targetFileName);
        assertTrue(a.imports.contains("b.dart"), a.imports.toString());
        assertTrue(a.code.contains("import 'b.dart';"), a.code);
        assertEquals(ComponentShape.NONE, a.shape);
        assertEquals(GenerationMethod.RULE_BASED, a.generationMethod);
        assertTrue(r.output("B.kt").imports.isEmpty());
    }

    @Test
    void threeUnitCycleConvertsEveryUnitAndWarnsOnce() {
        ConversionResult r = new ConversionService().convert(cycle(), new ConversionOptions());

        assertEquals(3, r.outputs.size());
        assertTrue(r.report.success);
        assertEquals(List.of(List.of("A.kt", "B.kt", "C.kt", "A.kt")), r.report.cycles);

        int cycleWarnings = 0;
        for (GenerationWarning w : r.report.warnings) {
            if (w.code.equals(GenerationWarnings.CYCLE)) {
                cycleWarnings++;
                assertEquals("A.kt, B.kt, C.kt, A.kt", w.context.get("units"));
            }
        }
        assertEquals(1, cycleWarnings);
    }

    @Test
    void failingUnitIsReportedAndOthersStillConvert() {
        List<String> acquired = Collections.synchronizedList(new ArrayList<>());
        List<String> released = Collections.synchronizedList(new ArrayList<>());
        ReadScope scope = new ReadScope() {
            @Override
            public void acquire(String unitPath) {
                if (unitPath.equals("B.kt")) throw new IllegalStateException("source model unavailable");
                acquired.add(unitPath);
            }

            @Override
            public void release(String unitPath) {
                released.add(unitPath);
            }
        };

        ConversionResult r = new ConversionService(scope, null).convert(cycle(), new ConversionOptions());

        assertFalse(r.report.success);
        assertEquals(1, r.report.errors.size());
        ConversionError e = r.report.errors.get(0);
        assertEquals(ConversionError.CONVERSION_ERROR, e.code);
        assertEquals("B.kt", e.unitPath);
        assertTrue(e.message.contains("source model unavailable"), e.message);

        assertEquals(2, r.outputs.size());
        assertNull(r.output("B.kt"));
        assertEquals(2, r.report.stats.convertedUnits);
        assertEquals(1, r.report.stats.failedUnits);
        assertEquals(3, r.report.stats.totalUnits);
        assertEquals(acquired, released);
    }

    @Test
    void readScopeIsReleasedPerUnit() {
        AtomicInteger depth = new AtomicInteger();
        AtomicInteger maxDepth = new AtomicInteger();
        ReadScope scope = new ReadScope() {
            @Override
            public void acquire(String unitPath) {
                maxDepth.accumulateAndGet(depth.incrementAndGet(), Math::max);
            }

            @Override
            public void release(String unitPath) {
                depth.decrementAndGet();
            }
        };
        new ConversionService(scope, null).convert(cycle(), new ConversionOptions());
        assertEquals(0, depth.get());
        assertEquals(1, maxDepth.get());
    }

    @Test
    void aiOutputReplacesRuleBasedCodeForFlaggedUnits() {
        AiConversionClient client = new AiConversionClient() {
            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public AiConversionResult convert(AiConversionRequest request) {
                assertFalse(request.ruleBasedCode.isEmpty());
                assertEquals("bloc", request.stateManagement);
                assertEquals(ConversionOptions.DEFAULT_NAVIGATION, request.navigation);
                return AiConversionResult.success("// ai " + request.targetPath + "\n");
            }
        };
        ConversionOptions options = new ConversionOptions();
        options.aiEnabled = true;
        options.complexityThreshold = -1;
        options.stateManagement = "bloc";

        ConversionResult r = new ConversionService(null, client).convert(chain(), options);

        UnitOutput a = r.output("A.kt");
        assertEquals(GenerationMethod.AI_ASSISTED, a.generationMethod);
        assertEquals("// ai a.dart\n", a.code);
        assertEquals(1, a.generatedLineCount);
        assertEquals(2, r.report.stats.aiAssistedUnits);
        assertTrue(r.report.warnings.isEmpty());
    }

    @Test
    void aiFailureFallsBackToRulesWithWarning() {
        AiConversionClient client = new AiConversionClient() {
            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public AiConversionResult convert(AiConversionRequest request) throws IOException {
                if (request.unitPath.equals("A.kt")) throw new IOException("timed out");
                return AiConversionResult.failure("refused");
            }
        };
        ConversionOptions options = new ConversionOptions();
        options.aiEnabled = true;
        options.complexityThreshold = -1;

        ConversionResult r = new ConversionService(null, client).convert(chain(), options);

        assertTrue(r.report.success);
        for (UnitOutput o : r.outputs) {
            assertEquals(GenerationMethod.RULE_BASED, o.generationMethod);
            assertTrue(o.code.contains("class "), o.code);
        }
        List<String> messages = new ArrayList<>();
        for (GenerationWarning w : r.report.warnings) {
            assertEquals(GenerationWarnings.AI_FALLBACK, w.code);
            messages.add(w.message);
        }
        assertEquals(2, messages.size());
        assertTrue(messages.get(0).contains("IOException: timed out"), messages.toString());
        assertTrue(messages.get(1).contains("refused"), messages.toString());
    }

    @Test
    void aiClientIsNotCalledWhenDisabledOrUnavailable() {
        AtomicInteger calls = new AtomicInteger();
        AiConversionClient client = new AiConversionClient() {
            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public AiConversionResult convert(AiConversionRequest request) {
                calls.incrementAndGet();
                return AiConversionResult.success("x");
            }
        };
        ConversionOptions options = new ConversionOptions();
        options.complexityThreshold = -1;
        new ConversionService(null, client).convert(chain(), options);
        assertEquals(0, calls.get());

        options.aiEnabled = true;
        ConversionResult r = new ConversionService().convert(chain(), options);
        assertTrue(r.report.warnings.isEmpty());
        for (UnitOutput o : r.outputs) assertEquals(GenerationMethod.RULE_BASED, o.generationMethod);
    }

    @Test
    void executorKeepsConversionOrder() throws Exception {
        SourceProject p = NotesSample.load();
        ConversionResult sequential = new ConversionService().convert(p, new ConversionOptions());

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            ConversionResult parallel = new ConversionService().convert(p, new ConversionOptions(), pool);
            assertEquals(paths(sequential), paths(parallel));
            for (int i = 0; i < sequential.outputs.size(); i++) {
                assertEquals(sequential.outputs.get(i).code, parallel.outputs.get(i).code);
            }
            assertEquals(ReportJson.toJsonString(sequential.report), ReportJson.toJsonString(parallel.report));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void convertsNotesSample() throws Exception {
        SourceProject p = NotesSample.load();
        ConversionResult r = new ConversionService().convert(p, new ConversionOptions());

        assertTrue(r.report.success, r.report.errors.toString());
        assertEquals(UNIT_COUNT, r.outputs.size());
        assertEquals(NOTE, r.outputs.get(0).unitPath);

        assertEquals(SCREEN_TARGET, r.output(SCREEN).targetPath);
        assertEquals(CARD_TARGET, r.output(CARD).targetPath);
        assertEquals(NOTE_TARGET, r.output(NOTE).targetPath);

        for (UnitOutput o : r.outputs) {
            for (String dep : r.plan.graph.dependenciesOf(o.unitPath)) {
                String expected = TargetLayout.relativeImport(o.targetPath, r.output(dep).targetPath);
                assertTrue(o.imports.contains(expected), o.unitPath + " imports " + expected);
            }
        }
        assertTrue(r.output(CARD).imports.contains("../model/note.dart"));
        assertTrue(r.output(SCREEN).imports.contains("package:flutter/material.dart"));
        assertNotEquals(ComponentShape.NONE, r.output(SCREEN).shape);
        assertTrue(r.output(SCREEN).components.contains("NotesScreen"));
        assertTrue(r.trees.containsKey(SCREEN));
        assertFalse(r.trees.containsKey(NOTE));
        assertEquals(UNIT_COUNT, r.report.complexity.size());
    }

    @Test
    void componentUnitRendersText() {
        SourceProject p = project("c", unit("ui/Hello.kt", "app.ui", List.of(), textComponent("Hello", "Hi")));
        ConversionResult r = new ConversionService().convert(p, new ConversionOptions());

        UnitOutput o = r.output("ui/Hello.kt");
        assertEquals("hello.dart", o.targetPath);
        assertEquals(ComponentShape.STATELESS, o.shape);
        assertEquals(List.of("Hello"), o.components);
        assertTrue(o.code.startsWith("// Converted from ui/Hello.kt"), o.code);
        assertTrue(o.code.contains("class Hello extends StatelessWidget"), o.code);
        assertTrue(o.code.contains("Text('Hi')"), o.code);
        assertEquals(1, r.report.stats.components);
    }

    @Test
    void positionalCallToProjectComponentUsesParameterNames() {
        SourceProject p = project("cards",
                unit("ui/NoteCard.kt", "app.ui", List.of(),
                        callingComponent("NoteCard", List.of(SourceParameter.of("note", "String")), "Text", "note")),
                unit("ui/NoteList.kt", "app.ui", List.of("app.ui.NoteCard"),
                        callingComponent("NoteList", List.of(SourceParameter.of("selected", "String")), "NoteCard", "selected")));

        assertEquals(List.of("note"), ConversionService.componentParameters(p).get("NoteCard"));

        ConversionResult r = new ConversionService().convert(p, new ConversionOptions());
        String card = r.output("ui/NoteCard.kt").code;
        String list = r.output("ui/NoteList.kt").code;
        assertTrue(card.contains("required this.note"), card);
        assertTrue(list.contains("NoteCard(note: selected)"), list);
        assertTrue(list.contains("import 'note_card.dart';"), list);
    }

    @Test
    void optionsReachTheGenerator() {
        ConversionOptions options = new ConversionOptions();
        options.sourceComments = false;
        options.widgetMappings.put("Text", "SelectableText");
        SourceProject p = project("c", unit("Hello.kt", "app", List.of(), textComponent("Hello", "Hi")));

        UnitOutput o = new ConversionService().convert(p, options).output("Hello.kt");
        assertFalse(o.code.contains("// Converted from"), o.code);
        assertTrue(o.code.contains("SelectableText("), o.code);
    }

    @Test
    void rejectsNullProject() {
        assertThrows(IllegalArgumentException.class, () -> new ConversionService().convert(null, null));
    }
}
