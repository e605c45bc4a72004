package info.isaksson.erland.composetoflutter.dart;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DartPrinterTest {

    private final DartPrinter printer = new DartPrinter();

    @Test
    void shortCallsStayOnOneLine() {
        DartExpr text = DartExpr.Call.builder("Text").positional(new DartExpr.Code("'Hi'")).constant(true).build();
        assertEquals("const Text('Hi')", printer.print(text));

        DartExpr padding = DartExpr.Call.builder("Padding")
                .named("padding", "const EdgeInsets.all(16)")
                .named("child", text)
                .build();
        assertEquals("Padding(padding: const EdgeInsets.all(16), child: const Text('Hi'))", printer.print(padding));
    }

    @Test
    void longCallsBreakWithTrailingCommas() {
        DartExpr column = DartExpr.Call.builder("Column")
                .named("children", new DartExpr.ListLiteral(List.of(
                        new DartExpr.Code("Text('The first line of a rather long column')"),
                        new DartExpr.Code("Text('The second line of the same column')")), false))
                .build();
        String expected = "Column(\n"
                + "  children: [\n"
                + "    Text('The first line of a rather long column'),\n"
                + "    Text('The second line of the same column'),\n"
                + "  ],\n"
                + ")";
        assertEquals(expected, printer.print(column));
    }

    @Test
    void indentationCountsAgainstTheWidth() {
        DartExpr call = DartExpr.Call.of("Text", new DartExpr.Code("'" + "x".repeat(60) + "'"));
        assertEquals(1, printer.print(call, 0).split("\n").length);
        String broken = printer.print(call, 7);
        assertTrue(broken.startsWith("Text(\n"));
        assertTrue(broken.endsWith("\n              )"));
    }

    @Test
    void brokenTernaryPutsBranchesOnOwnLines() {
        DartExpr longBranch = DartExpr.Call.of("Text", new DartExpr.Code("'" + "y".repeat(70) + "'"));
        DartExpr t = new DartExpr.Ternary("isLoading", new DartExpr.Code("CircularProgressIndicator()"), longBranch);
        String out = printer.print(t, 0);
        String[] lines = out.split("\n");
        assertEquals("isLoading", lines[0]);
        assertEquals("    ? CircularProgressIndicator()", lines[1]);
        assertTrue(lines[2].startsWith("    : Text("));
    }

    @Test
    void callbacksPrintInArrowOrBlockForm() {
        assertEquals("() => go()", printer.print(DartExpr.Callback.arrow(List.of(), new DartExpr.Code("go()"))));
        assertEquals("() { go(); }", printer.print(DartExpr.Callback.block(List.of(), List.of("go()"))));
        assertEquals("() {}", printer.print(DartExpr.Callback.block(List.of(), List.of())));
        assertEquals("(it) {\n  a();\n  b();\n}",
                printer.print(DartExpr.Callback.block(List.of("it"), List.of("a()", "b()"))));
    }

    @Test
    void multiLineStatementsAreReindented() {
        DartExpr cb = DartExpr.Callback.block(List.of(), List.of("setState(() {\n  count++;\n})"));
        assertEquals("() {\n  setState(() {\n    count++;\n  });\n}", printer.print(cb));
    }

    @Test
    void spreadMapsEachElement() {
        DartExpr spread = new DartExpr.Spread("notes", "note", new DartExpr.Code("Text(note.title)"));
        DartExpr list = new DartExpr.ListLiteral(List.of(spread), false);
        assertEquals("[...notes.map((note) => Text(note.title))]", printer.print(list));
    }

    @Test
    void emptyListsAndCallsKeepTheirBrackets() {
        assertEquals("const []", printer.print(new DartExpr.ListLiteral(List.of(), true)));
        assertEquals("const SizedBox.shrink()",
                printer.print(DartExpr.Call.builder("SizedBox.shrink").constant(true).build()));
    }
}
