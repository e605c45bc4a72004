package info.isaksson.erland.composetoflutter.graph;

import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import info.isaksson.erland.composetoflutter.ir.SourceExprWalker;
import info.isaksson.erland.composetoflutter.ir.SourceUnit;

/**
 * Estimates conversion effort per unit.
 *
 * <p>Class-like declarations cost 5 plus one per member, functions cost 2 (5 for UI
 * components), properties cost 1. Function bodies add their branching count.</p>
 */
public final class ComplexityCalculator {

    private ComplexityCalculator() {}

    public static int unitComplexity(SourceUnit unit) {
        int total = 0;
        for (SourceDeclaration d : unit.declarations) {
            total += declarationComplexity(d);
        }
        return total;
    }

    public static int declarationComplexity(SourceDeclaration d) {
        switch (d.kind) {
            case FUNCTION: {
                int c = 2;
                if (d.isComposable()) c += 3;
                return c + branchCount(d.body);
            }
            case PROPERTY:
                return 1;
            default: {
                int c = 5 + d.members.size();
                for (SourceDeclaration m : d.members) {
                    c += branchCount(m.body);
                }
                return c;
            }
        }
    }

    /** if +1, when +entries, loops +1, try +1 plus one per catch. */
    public static int branchCount(SourceExpr body) {
        int[] count = {0};
        SourceExprWalker.walk(body, e -> {
            if (e instanceof SourceExpr.If) {
                count[0] += 1;
            } else if (e instanceof SourceExpr.When w) {
                count[0] += w.entries.size();
            } else if (e instanceof SourceExpr.For || e instanceof SourceExpr.While) {
                count[0] += 1;
            } else if (e instanceof SourceExpr.Try t) {
                count[0] += 1 + t.catchCount;
            }
        });
        return count[0];
    }
}
