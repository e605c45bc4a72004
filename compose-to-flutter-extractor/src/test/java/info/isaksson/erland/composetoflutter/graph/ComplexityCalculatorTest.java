package info.isaksson.erland.composetoflutter.graph;

import info.isaksson.erland.composetoflutter.ir.DeclarationKind;
import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.composetoflutter.testutil.Sources.*;
import static org.junit.jupiter.api.Assertions.*;

public class ComplexityCalculatorTest {

    @Test
    void branchesAreCountedThroughNestedBodies() {
        SourceExpr.When when = new SourceExpr.When("when (x) { ... }", "x", List.of(
                new SourceExpr.WhenEntry(List.of("1"), false, call("A")),
                new SourceExpr.WhenEntry(List.of(), true, call("B"))));
        SourceExpr.If inner = new SourceExpr.If("if (y) ...", "y", block(when), null);
        SourceExpr.For loop = new SourceExpr.For("for (i in xs) ...", "i", "xs", block(inner));
        SourceExpr.Try tr = new SourceExpr.Try("try { } catch ...", block(), 2, true);
        assertEquals(1 + 1 + 2 + 3, ComplexityCalculator.branchCount(block(loop, tr)));
    }

    @Test
    void composableFunctionsCostMore() {
        SourceDeclaration plain = SourceDeclaration.function("f", null, null, null, null);
        SourceDeclaration ui = composable("Screen", block(new SourceExpr.If("if (a) B()", "a", call("B"), null)));
        assertEquals(2, ComplexityCalculator.declarationComplexity(plain));
        assertEquals(6, ComplexityCalculator.declarationComplexity(ui));
        assertEquals(1, ComplexityCalculator.declarationComplexity(SourceDeclaration.property("p", "Int", false, "1")));
    }

    @Test
    void classCostsIncludeMembers() {
        SourceDeclaration c = SourceDeclaration.type(DeclarationKind.CLASS, "Repo", null, null, List.of(
                SourceDeclaration.property("items", "List<Int>", false, null),
                SourceDeclaration.function("load", null, null, null,
                        block(new SourceExpr.While("while (x) { }", "x", block(), false)))));
        assertEquals(5 + 2 + 1, ComplexityCalculator.declarationComplexity(c));
    }
}
