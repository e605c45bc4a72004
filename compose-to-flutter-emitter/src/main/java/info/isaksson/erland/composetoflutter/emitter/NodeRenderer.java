package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.dart.DartExpr;
import info.isaksson.erland.composetoflutter.ir.UiNode;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;

import java.util.ArrayList;
import java.util.List;

/** Renders UI nodes of one component into target expressions. */
final class NodeRenderer implements UiNode.Visitor<DartExpr> {

    static final DartExpr.Call EMPTY = DartExpr.Call.builder("SizedBox.shrink").constant(true).build();

    private final ExpressionRewriter rewriter;
    private final WidgetRenderer widgets;

    NodeRenderer(ComponentScope scope, GenerationContext ctx) {
        this.rewriter = scope.rewriter;
        ArgumentRenderer args = new ArgumentRenderer(scope, ctx, this::group);
        this.widgets = new WidgetRenderer(this, args, new ModifierChainResolver(ctx, args), ctx);
    }

    DartExpr render(UiNode node) {
        return node.accept(this);
    }

    /** Nothing renders as an empty box, one node as itself, several nodes as a Column. */
    DartExpr group(List<UiNode> nodes) {
        if (nodes.isEmpty()) return EMPTY;
        if (nodes.size() == 1 && !(nodes.get(0) instanceof UiNode.Iteration)) return render(nodes.get(0));
        return DartExpr.Call.builder("Column").named("children", children(nodes)).build();
    }

    /** Children list; iterations spread into it. */
    DartExpr.ListLiteral children(List<UiNode> nodes) {
        if (nodes.isEmpty()) return new DartExpr.ListLiteral(List.of(), true);
        List<DartExpr> items = new ArrayList<>();
        for (UiNode n : nodes) {
            if (n instanceof UiNode.Iteration it) {
                items.add(spread(it));
            } else {
                items.add(render(n));
            }
        }
        return new DartExpr.ListLiteral(items, false);
    }

    @Override
    public DartExpr visitWidget(UiNode.Widget widget) {
        return widgets.render(widget);
    }

    @Override
    public DartExpr visitConditional(UiNode.Conditional conditional) {
        return new DartExpr.Ternary(
                rewriter.rewrite(conditional.condition),
                group(conditional.thenBranch),
                group(conditional.elseBranch));
    }

    /**
     * Left-to-right ternary chain. A non-empty last branch is the terminal expression;
     * an empty one leaves the chain ending in an empty box. A lone conditioned branch keeps
     * its condition.
     */
    @Override
    public DartExpr visitMultiBranch(UiNode.MultiBranch multiBranch) {
        List<UiNode.Branch> branches = multiBranch.branches;
        if (branches.isEmpty()) return EMPTY;
        UiNode.Branch last = branches.get(branches.size() - 1);
        DartExpr result;
        if (branches.size() == 1 && !last.isElse) {
            result = new DartExpr.Ternary(condition(multiBranch.subject, last), group(last.nodes), EMPTY);
        } else {
            result = last.nodes.isEmpty() ? EMPTY : group(last.nodes);
        }
        for (int i = branches.size() - 2; i >= 0; i--) {
            UiNode.Branch b = branches.get(i);
            result = new DartExpr.Ternary(condition(multiBranch.subject, b), group(b.nodes), result);
        }
        return result;
    }

    @Override
    public DartExpr visitIteration(UiNode.Iteration iteration) {
        return DartExpr.Call.builder("Column")
                .named("children", new DartExpr.ListLiteral(List.of(spread(iteration)), false))
                .build();
    }

    private DartExpr spread(UiNode.Iteration it) {
        return new DartExpr.Spread(rewriter.iterationSource(it.source), it.variable, group(it.children));
    }

    String condition(String subject, UiNode.Branch branch) {
        if (branch.isElse) return UiNode.Branch.ELSE_CONDITION;
        List<String> parts = new ArrayList<>();
        for (String c : splitConditions(branch.condition)) {
            String cond = c.trim();
            if (cond.isEmpty()) continue;
            parts.add(subject == null ? rewriter.rewrite(cond) : subjectTest(rewriter.rewrite(subject), cond));
        }
        if (parts.isEmpty()) return UiNode.Branch.ELSE_CONDITION;
        if (parts.size() == 1) return parts.get(0);
        return "(" + String.join(" || ", parts) + ")";
    }

    private String subjectTest(String subject, String cond) {
        if (cond.startsWith("!is ")) return subject + " is! " + cond.substring(4).trim();
        if (cond.startsWith("is ")) return subject + " is " + cond.substring(3).trim();
        if (cond.startsWith("!in ")) return "!" + rangeTest(subject, cond.substring(4).trim());
        if (cond.startsWith("in ")) return rangeTest(subject, cond.substring(3).trim());
        return subject + " == " + rewriter.rewrite(cond);
    }

    // a..b is inclusive; a until b and a..<b exclude the upper bound.
    private String rangeTest(String subject, String range) {
        int until = range.indexOf(" until ");
        if (until > 0) {
            return bounds(subject, range.substring(0, until), " < ", range.substring(until + 7));
        }
        int open = range.indexOf("..<");
        if (open > 0) {
            return bounds(subject, range.substring(0, open), " < ", range.substring(open + 3));
        }
        int dots = range.indexOf("..");
        if (dots > 0) {
            return bounds(subject, range.substring(0, dots), " <= ", range.substring(dots + 2));
        }
        return rewriter.rewrite(range) + ".contains(" + subject + ")";
    }

    private String bounds(String subject, String low, String upperOp, String high) {
        return "(" + subject + " >= " + rewriter.rewrite(low.trim())
                + " && " + subject + upperOp + rewriter.rewrite(high.trim()) + ")";
    }

    // Commas outside parentheses, brackets, braces and string literals.
    static List<String> splitConditions(String conditions) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        boolean inString = false;
        int start = 0;
        for (int i = 0; i < conditions.length(); i++) {
            char c = conditions.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == '"') inString = false;
            } else if (c == '"') {
                inString = true;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                out.add(conditions.substring(start, i));
                start = i + 1;
            }
        }
        out.add(conditions.substring(start));
        return out;
    }
}
