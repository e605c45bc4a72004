package info.isaksson.erland.composetoflutter.mapping;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionRewriterTest {

    private final ExpressionRewriter plain = ExpressionRewriter.plain();

    @Test
    void requotesStringsAndDropsUnits() {
        assertEquals("'Hello'", plain.rewrite("\"Hello\""));
        assertEquals("'it\\'s'", plain.rewrite("\"it's\""));
        assertEquals("16", plain.rewrite("16.dp"));
        assertEquals("14", plain.rewrite("14.sp"));
        assertEquals("0.5", plain.rewrite("0.5f"));
    }

    @Test
    void rewritesFrameworkConstants() {
        assertEquals("Colors.red", ExpressionRewriter.rewriteConstants("Color.Red"));
        assertEquals("Colors.grey", ExpressionRewriter.rewriteConstants("Color.Gray"));
        assertEquals("Icons.arrow_back", ExpressionRewriter.rewriteConstants("Icons.Default.ArrowBack"));
        assertEquals("Icons.star_outlined", ExpressionRewriter.rewriteConstants("Icons.Outlined.Star"));
        assertEquals("Alignment.topLeft", ExpressionRewriter.rewriteConstants("Alignment.TopStart"));
        assertEquals("MainAxisAlignment.spaceBetween", ExpressionRewriter.rewriteConstants("Arrangement.SpaceBetween"));
        assertEquals("FontWeight.bold", ExpressionRewriter.rewriteConstants("FontWeight.Bold"));
        assertEquals("BoxFit.cover", ExpressionRewriter.rewriteConstants("ContentScale.Crop"));
        assertEquals("Theme.of(context).textTheme.titleLarge",
                ExpressionRewriter.rewriteConstants("MaterialTheme.typography.titleLarge"));
    }

    @Test
    void translatesOperatorsAndCollectionBuilders() {
        assertEquals("a ?? b", plain.rewrite("a ?: b"));
        assertEquals("x!.size", plain.rewrite("x!!.size"));
        assertEquals("[1, 2]", plain.rewrite("listOf(1, 2)"));
        assertEquals("[]", plain.rewrite("emptyList()"));
        assertEquals("print('hi')", plain.rewrite("println(\"hi\")"));
        assertEquals("Note(id: 1, title: 'x')", plain.rewrite("Note(id = 1, title = \"x\")"));
    }

    @Test
    void stateReadsLoseValueAndFieldsGoThroughWidget() {
        ExpressionRewriter rw = new ExpressionRewriter(Set.of("count"), Set.of("title"));
        assertTrue(rw.isStateName("count"));
        assertEquals("count + 1", rw.rewrite("count.value + 1"));
        assertEquals("widget.title", rw.rewrite("title"));
        assertEquals("title = 'x'", rw.rewrite("title = \"x\""));
        assertEquals("'${widget.title} has $count'", rw.rewrite("\"$title has ${count.value}\""));
    }

    @Test
    void rangesBecomeGeneratedLists() {
        assertEquals("List.generate(5, (i) => i)", plain.iterationSource("0 until 5"));
        assertEquals("List.generate(3 - 1 + 1, (i) => 1 + i)", plain.iterationSource("1..3"));
        assertEquals("notes", plain.iterationSource("notes"));
    }

    @Test
    void namingHelpers() {
        assertEquals("arrow_back", ExpressionRewriter.snakeCase("ArrowBack"));
        assertEquals("note_card", ExpressionRewriter.snakeCase("NoteCard"));
        assertEquals("fooBar", ExpressionRewriter.lowerFirst("FooBar"));
        assertTrue(ExpressionRewriter.isIdentifier("_x1"));
        assertFalse(ExpressionRewriter.isIdentifier("1x"));
    }
}
