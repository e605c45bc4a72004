package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.dart.DartPrinter;
import info.isaksson.erland.composetoflutter.ir.ModifierDirective;
import info.isaksson.erland.composetoflutter.ir.UiNode;
import info.isaksson.erland.composetoflutter.ir.UiTree;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static info.isaksson.erland.composetoflutter.testutil.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class ModifierChainResolverTest {

    private final GenerationContext ctx = new GenerationContext("ui/Test.kt", Set.of(), GeneratorOptions.defaults(), new GenerationWarnings());

    private String render(ModifierDirective... modifiers) {
        UiNode node = widget("Text", args("arg0", text("x").argument("arg0")), List.of(modifiers));
        UiTree tree = new UiTree("Sample", null, null, List.of(node));
        NodeRenderer renderer = new NodeRenderer(new ComponentScope(tree), ctx);
        return new DartPrinter(400).print(renderer.render(node));
    }

    @Test
    void clickableAroundPaddingAroundText() {
        UiNode node = widget("Text", args("arg0", text("Hi").argument("arg0")),
                List.of(modifier("padding", "16.dp"), modifier("clickable", "{ go() }")));
        UiTree tree = new UiTree("Sample", null, null, List.of(node));
        String out = new DartPrinter(400).print(new NodeRenderer(new ComponentScope(tree), ctx).render(node));
        assertEquals("GestureDetector(onTap: () => go(), child: Padding(padding: const EdgeInsets.all(16), child: const Text('Hi')))", out);
    }

    @Test
    void firstDirectiveIsInnermost() {
        assertEquals("Opacity(opacity: 0.5, child: ColoredBox(color: Colors.red, child: "
                        + "Padding(padding: const EdgeInsets.all(8), child: const Text('x'))))",
                render(modifier("padding", "8.dp"), modifier("background", "Color.Red"), modifier("alpha", "0.5f")));
    }

    @Test
    void sizingDirectives() {
        assertEquals("SizedBox(width: double.infinity, child: const Text('x'))", render(ModifierDirective.of("fillMaxWidth")));
        assertEquals("SizedBox.expand(child: const Text('x'))", render(ModifierDirective.of("fillMaxSize")));
        assertEquals("FractionallySizedBox(widthFactor: 0.5, child: const Text('x'))", render(modifier("fillMaxWidth", "0.5f")));
        assertEquals("SizedBox(width: 48, height: 48, child: const Text('x'))", render(modifier("size", "48.dp")));
        assertEquals("SizedBox(height: 20, child: const Text('x'))", render(modifier("height", "20.dp")));
        assertEquals("Expanded(flex: 1, child: const Text('x'))", render(modifier("weight", "1f")));
        assertEquals("Expanded(flex: 2, child: const Text('x'))", render(modifier("weight", "2f")));
    }

    @Test
    void shapesBecomeDecorationsAndClips() {
        assertEquals("DecoratedBox(decoration: BoxDecoration(color: Colors.blue, borderRadius: BorderRadius.circular(8)), child: const Text('x'))",
                render(modifier("background", "Color.Blue", "RoundedCornerShape(8.dp)")));
        assertEquals("DecoratedBox(decoration: BoxDecoration(color: Colors.blue, shape: BoxShape.circle), child: const Text('x'))",
                render(modifier("background", "Color.Blue", "CircleShape")));
        assertEquals("ClipOval(child: const Text('x'))", render(modifier("clip", "CircleShape")));
        assertEquals("ClipRRect(borderRadius: BorderRadius.circular(12), child: const Text('x'))",
                render(modifier("clip", "RoundedCornerShape(12.dp)")));
        assertEquals("DecoratedBox(decoration: BoxDecoration(border: Border.all(width: 1, color: Colors.grey)), child: const Text('x'))",
                render(modifier("border", "1.dp", "Color.Gray")));
    }

    @Test
    void rotationRequestsTheMathImport() {
        assertEquals("Transform.rotate(angle: 45 * pi / 180, child: const Text('x'))", render(modifier("rotate", "45f")));
        assertTrue(ctx.requiredImports().contains(GenerationContext.MATH_IMPORT));
    }

    @Test
    void scrollAndAlignment() {
        assertEquals("SingleChildScrollView(child: const Text('x'))", render(modifier("verticalScroll", "rememberScrollState()")));
        assertEquals("SingleChildScrollView(scrollDirection: Axis.horizontal, child: const Text('x'))",
                render(modifier("horizontalScroll", "rememberScrollState()")));
        assertEquals("Align(alignment: Alignment.topLeft, child: const Text('x'))", render(modifier("align", "Alignment.TopStart")));
        assertEquals("Transform.translate(offset: Offset(4, 0), child: const Text('x'))", render(modifier("offset", "4.dp")));
    }

    @Test
    void unknownDirectiveIsDroppedWithOneWarning() {
        assertEquals("const Text('x')", render(modifier("semantics", "{ heading() }")));
        List<GenerationWarning> warnings = ctx.warnings().toDeterministicList();
        assertEquals(1, warnings.size());
        assertEquals(GenerationWarnings.UNKNOWN_MODIFIER, warnings.get(0).code);
        assertEquals("Modifier dropped: semantics", warnings.get(0).message);
        assertEquals("semantics", warnings.get(0).context.get("name"));
        assertEquals("ui/Test.kt", warnings.get(0).context.get("unit"));
    }

    @Test
    void insetsPickTheNarrowestForm() {
        ExpressionRewriter rw = ExpressionRewriter.plain();
        assertEquals("EdgeInsets.zero", ModifierChainResolver.insets(Map.of(), rw));
        assertEquals("const EdgeInsets.all(16)", ModifierChainResolver.insets(Map.of("all", "16.dp"), rw));
        assertEquals("EdgeInsets.all(spacing)", ModifierChainResolver.insets(Map.of("0", "spacing"), rw));

        Map<String, String> symmetric = new LinkedHashMap<>();
        symmetric.put("horizontal", "16.dp");
        symmetric.put("vertical", "8.dp");
        assertEquals("const EdgeInsets.symmetric(horizontal: 16, vertical: 8)", ModifierChainResolver.insets(symmetric, rw));

        Map<String, String> only = new LinkedHashMap<>();
        only.put("top", "2.dp");
        only.put("start", "4.dp");
        assertEquals("const EdgeInsets.only(left: 4, top: 2)", ModifierChainResolver.insets(only, rw));
    }

    @Test
    void flexRoundsToAtLeastOne() {
        assertEquals("1", ModifierChainResolver.flex(null));
        assertEquals("1", ModifierChainResolver.flex("0.3f"));
        assertEquals("3", ModifierChainResolver.flex("3f"));
        assertEquals("1", ModifierChainResolver.flex("ratio"));
    }
}
