package info.isaksson.erland.composetoflutter.extract;

import info.isaksson.erland.composetoflutter.ir.ArgumentValue;
import info.isaksson.erland.composetoflutter.ir.ModifierDirective;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import info.isaksson.erland.composetoflutter.ir.SourceProject;
import info.isaksson.erland.composetoflutter.ir.StateFlavor;
import info.isaksson.erland.composetoflutter.ir.UiNode;
import info.isaksson.erland.composetoflutter.ir.UiTree;
import info.isaksson.erland.composetoflutter.testutil.NotesSample;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static info.isaksson.erland.composetoflutter.testutil.Sources.*;
import static org.junit.jupiter.api.Assertions.*;

public class UiTreeExtractorTest {

    private final UiTreeExtractor extractor = new UiTreeExtractor();

    private static UiNode.Widget widget(UiNode node) {
        assertInstanceOf(UiNode.Widget.class, node);
        return (UiNode.Widget) node;
    }

    @Test
    void notesScreenTreeFromSample() throws IOException {
        SourceProject p = NotesSample.load();
        List<UiTree> trees = extractor.extractUnit(p.units.get(0));
        assertEquals(1, trees.size());
        UiTree screen = trees.get(0);
        assertEquals("NotesScreen", screen.name);
        assertTrue(screen.isStateful());
        assertEquals("String", screen.stateVariable("query").type);
        assertEquals(StateFlavor.PLAIN, screen.stateVariable("query").flavor);

        UiNode.Widget scaffold = widget(screen.roots.get(0));
        assertEquals("Scaffold", scaffold.name);
        ArgumentValue.Closure topBar = (ArgumentValue.Closure) scaffold.argument("topBar");
        assertEquals("TopAppBar", widget(topBar.nodes.get(0)).name);

        UiNode.Widget column = widget(scaffold.children.get(0));
        assertEquals("Column", column.name);
        assertTrue(column.arguments.isEmpty());
        assertEquals("padding", column.modifiers.get(0).name);
        assertEquals("16.dp", column.modifiers.get(0).positional(0));

        UiNode.Widget field = widget(column.children.get(0));
        assertEquals("query", ((ArgumentValue.Reference) field.argument("value")).name);
        ArgumentValue.Closure onChange = (ArgumentValue.Closure) field.argument("onValueChange");
        assertEquals(List.of("query = it"), onChange.statements);

        UiNode.Iteration loop = (UiNode.Iteration) column.children.get(1);
        assertEquals("note", loop.variable);
        assertEquals("repository.all()", loop.source);
        assertEquals("NoteCard", widget(loop.children.get(0)).name);
    }

    @Test
    void noteCardKeepsModifierOrderAndConditional() throws IOException {
        SourceProject p = NotesSample.load();
        UiTree card = extractor.extractUnit(p.units.get(1)).get(0);
        assertFalse(card.isStateful());

        UiNode.Widget root = widget(card.roots.get(0));
        assertEquals("Card", root.name);
        assertEquals(List.of("padding", "clickable"), root.modifiers.stream().map(m -> m.name).toList());
        assertEquals("{ onClick() }", root.modifiers.get(1).positional(0));

        UiNode.Widget text = widget(root.children.get(0));
        assertEquals("note.title", ((ArgumentValue.Reference) text.argument("arg0")).name);
        assertEquals("18.sp", text.argument("fontSize").text());

        UiNode.Conditional pinned = (UiNode.Conditional) root.children.get(1);
        assertEquals("note.pinned", pinned.condition);
        assertTrue(pinned.elseBranch.isEmpty());
        UiNode.Widget icon = widget(pinned.thenBranch.get(0));
        assertEquals("Icons.Default.Star", icon.argument("arg0").text());
        assertEquals("Pinned", ((ArgumentValue.StringValue) icon.argument("contentDescription")).value);
    }

    @Test
    void nonUiUnitsYieldNoTrees() throws IOException {
        SourceProject p = NotesSample.load();
        assertTrue(extractor.extractUnit(p.units.get(2)).isEmpty());
        assertTrue(extractor.extractUnit(p.units.get(3)).isEmpty());
    }

    @Test
    void transparentScopesLiftTheirContent() {
        SourceExpr body = block(
                call("CompositionLocalProvider", List.of(arg(name("LocalX provides y"))), lambda(call("Text", arg(str("a"))))),
                call("LaunchedEffect", List.of(arg(name("Unit"))), lambda(call("load"))),
                call("key", List.of(arg(name("id"))), lambda(call("Divider"))));
        List<UiNode> nodes = extractor.extractNodes(body);
        assertEquals(2, nodes.size());
        assertEquals("Text", widget(nodes.get(0)).name);
        assertEquals("Divider", widget(nodes.get(1)).name);
    }

    @Test
    void lowercaseCallsAndOtherStatementsAreIgnored() {
        SourceExpr body = block(call("println", arg(str("x"))), other("x += 1"),
                new SourceExpr.While("while (a) { Text() }", "a", call("Text"), false));
        assertTrue(extractor.extractNodes(body).isEmpty());
    }

    @Test
    void lazyItemsBecomeIteration() {
        SourceExpr body = call("LazyColumn", List.of(), lambda(
                call("items", List.of(arg(name("notes"))), lambdaWith(List.of("note"), call("NoteCard", arg("note", name("note"))))),
                call("itemsIndexed", List.of(arg(name("tags"))), lambdaWith(List.of("i", "tag"), call("Text", arg(name("tag"))))),
                call("item", List.of(), lambda(call("Spacer")))));
        UiNode.Widget list = widget(extractor.extractNodes(body).get(0));
        assertEquals(3, list.children.size());
        UiNode.Iteration items = (UiNode.Iteration) list.children.get(0);
        assertEquals("note", items.variable);
        assertEquals("notes", items.source);
        assertEquals("tag", ((UiNode.Iteration) list.children.get(1)).variable);
        assertEquals("Spacer", widget(list.children.get(2)).name);
    }

    @Test
    void contentArgumentProvidesChildren() {
        SourceExpr body = call("Card", arg("elevation", other("4.dp")), arg("content", lambda(call("Text", arg(str("x"))))));
        UiNode.Widget card = widget(extractor.extractNodes(body).get(0));
        assertEquals(List.of("elevation"), List.copyOf(card.arguments.keySet()));
        assertEquals("Text", widget(card.children.get(0)).name);
    }

    @Test
    void unnamedStyleArgumentIsSkippedAndPositionsAreKept() {
        SourceExpr chain = modifierChain(call("fillMaxWidth"), call("padding", arg("horizontal", other("8.dp"))));
        SourceExpr body = call("Box", arg(chain), arg(str("x")), arg(other("3")));
        UiNode.Widget box = widget(extractor.extractNodes(body).get(0));
        assertEquals(List.of("arg1", "arg2"), List.copyOf(box.arguments.keySet()));
        assertEquals(3L, ((ArgumentValue.IntValue) box.argument("arg2")).value);
        List<ModifierDirective> mods = box.modifiers;
        assertEquals("fillMaxWidth", mods.get(0).name);
        assertEquals("8.dp", mods.get(1).argument("horizontal", 0));
    }

    @Test
    void conditionalWithoutUiIsDropped() {
        SourceExpr body = block(
                new SourceExpr.If("if (a) log()", "a", call("log"), null),
                new SourceExpr.If("if (b) A() else B()", "b", call("A"), call("B")));
        List<UiNode> nodes = extractor.extractNodes(body);
        assertEquals(1, nodes.size());
        UiNode.Conditional c = (UiNode.Conditional) nodes.get(0);
        assertEquals("b", c.condition);
        assertEquals("B", widget(c.elseBranch.get(0)).name);
    }

    @Test
    void whenKeepsBranchOrderAndMarksElse() {
        SourceExpr.When when = new SourceExpr.When("when (state) { ... }", "state", List.of(
                new SourceExpr.WhenEntry(List.of("is Loading"), false, call("CircularProgressIndicator")),
                new SourceExpr.WhenEntry(List.of("Error", "Empty"), false, call("Text", arg(str("none")))),
                new SourceExpr.WhenEntry(List.of(), true, block())));
        UiNode.MultiBranch mb = (UiNode.MultiBranch) extractor.extractNodes(when).get(0);
        assertEquals("state", mb.subject);
        assertEquals(3, mb.branches.size());
        assertEquals("is Loading", mb.branches.get(0).condition);
        assertEquals("Error, Empty", mb.branches.get(1).condition);
        assertTrue(mb.branches.get(2).isElse);
        assertEquals("true", mb.branches.get(2).condition);
        assertTrue(mb.branches.get(2).nodes.isEmpty());
    }

    @Test
    void forLoopWithoutVariableUsesDefault() {
        SourceExpr.For loop = new SourceExpr.For("for (...) Text(it)", null, "names", call("Text", arg(name("it"))));
        UiNode.Iteration it = (UiNode.Iteration) extractor.extractNodes(loop).get(0);
        assertEquals("it", it.variable);
        assertTrue(extractor.extractNodes(new SourceExpr.For("for (x in y) {}", "x", "y", block())).isEmpty());
    }

    @Test
    void qualifiedCallRecursesIntoSelector() {
        SourceExpr expr = dot(name("scope"), call("Row", List.of(), lambda(call("Icon"))));
        UiNode.Widget row = widget(extractor.extractNodes(expr).get(0));
        assertEquals("Row", row.name);
        assertEquals(1, row.children.size());
    }

    @Test
    void extractRejectsNonFunctions() {
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(cls("A")));
        assertThrows(IllegalArgumentException.class, () -> extractor.extractUnit(null));
    }
}
