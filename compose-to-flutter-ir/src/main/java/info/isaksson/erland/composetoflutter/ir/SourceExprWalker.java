package info.isaksson.erland.composetoflutter.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/** Generic traversal over {@link SourceExpr} trees. */
public final class SourceExprWalker {

    private SourceExprWalker() {}

    /** Direct children in source order. */
    public static List<SourceExpr> children(SourceExpr expr) {
        List<SourceExpr> out = new ArrayList<>();
        if (expr instanceof SourceExpr.Block b) {
            out.addAll(b.statements);
        } else if (expr instanceof SourceExpr.Call c) {
            for (SourceExpr.Argument a : c.arguments) out.add(a.value);
            out.addAll(c.trailingLambdas);
        } else if (expr instanceof SourceExpr.Qualified q) {
            out.add(q.receiver);
            out.add(q.selector);
        } else if (expr instanceof SourceExpr.If i) {
            addIfPresent(out, i.thenBranch);
            addIfPresent(out, i.elseBranch);
        } else if (expr instanceof SourceExpr.When w) {
            for (SourceExpr.WhenEntry e : w.entries) addIfPresent(out, e.body);
        } else if (expr instanceof SourceExpr.For f) {
            addIfPresent(out, f.body);
        } else if (expr instanceof SourceExpr.While w) {
            addIfPresent(out, w.body);
        } else if (expr instanceof SourceExpr.Try t) {
            addIfPresent(out, t.body);
        } else if (expr instanceof SourceExpr.Lambda l) {
            out.add(l.body);
        } else if (expr instanceof SourceExpr.Binding b) {
            addIfPresent(out, b.initializer);
        }
        return out;
    }

    /** Pre-order visit of {@code root} and all descendants. Iterative, so deep trees are fine. */
    public static void walk(SourceExpr root, Consumer<SourceExpr> visitor) {
        if (root == null) return;
        Deque<SourceExpr> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SourceExpr e = stack.pop();
            visitor.accept(e);
            List<SourceExpr> kids = children(e);
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }
    }

    private static void addIfPresent(List<SourceExpr> out, SourceExpr e) {
        if (e != null) out.add(e);
    }
}
