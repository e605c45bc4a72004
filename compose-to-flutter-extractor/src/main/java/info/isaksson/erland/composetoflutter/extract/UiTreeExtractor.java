package info.isaksson.erland.composetoflutter.extract;

import info.isaksson.erland.composetoflutter.ir.ArgumentValue;
import info.isaksson.erland.composetoflutter.ir.DeclarationKind;
import info.isaksson.erland.composetoflutter.ir.ModifierDirective;
import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import info.isaksson.erland.composetoflutter.ir.SourceUnit;
import info.isaksson.erland.composetoflutter.ir.StateVariable;
import info.isaksson.erland.composetoflutter.ir.UiNode;
import info.isaksson.erland.composetoflutter.ir.UiTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts structural UI trees from component function bodies.
 *
 * <p>Extraction is total: expression kinds that carry no UI are skipped, and a body without
 * any UI yields a tree with no roots. The extractor keeps no state between calls.</p>
 */
public final class UiTreeExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(UiTreeExtractor.class);

    private final ArgumentClassifier classifier = new ArgumentClassifier(this::extractNodes);

    /** One tree per top-level {@code @Composable} function, in declaration order. */
    public List<UiTree> extractUnit(SourceUnit unit) {
        if (unit == null) throw new IllegalArgumentException("unit must not be null");
        List<UiTree> trees = new ArrayList<>();
        for (SourceDeclaration d : unit.declarations) {
            if (d.kind == DeclarationKind.FUNCTION && d.isComposable()) {
                trees.add(extract(d));
            }
        }
        LOG.debug("Extracted {} UI tree(s) from {}", trees.size(), unit.path);
        return trees;
    }

    public UiTree extract(SourceDeclaration function) {
        if (function == null) throw new IllegalArgumentException("function must not be null");
        if (function.kind != DeclarationKind.FUNCTION) {
            throw new IllegalArgumentException("not a function: " + function.name);
        }
        List<StateVariable> state = StateVariableExtractor.extract(function.body);
        List<UiNode> roots = extractNodes(function.body);
        return new UiTree(function.name, function.parameters, state, roots);
    }

    public List<UiNode> extractNodes(SourceExpr expr) {
        List<UiNode> out = new ArrayList<>();
        collect(expr, out);
        return out;
    }

    private void collect(SourceExpr expr, List<UiNode> out) {
        if (expr == null) return;
        if (expr instanceof SourceExpr.Block b) {
            for (SourceExpr s : b.statements) collect(s, out);
        } else if (expr instanceof SourceExpr.Call c) {
            collectCall(c, out);
        } else if (expr instanceof SourceExpr.Qualified q) {
            collect(q.selector, out);
        } else if (expr instanceof SourceExpr.If i) {
            List<UiNode> then = extractNodes(i.thenBranch);
            List<UiNode> otherwise = extractNodes(i.elseBranch);
            if (!then.isEmpty() || !otherwise.isEmpty()) {
                out.add(new UiNode.Conditional(i.condition.trim(), then, otherwise));
            }
        } else if (expr instanceof SourceExpr.When w) {
            collectWhen(w, out);
        } else if (expr instanceof SourceExpr.For f) {
            List<UiNode> body = extractNodes(f.body);
            if (!body.isEmpty()) {
                out.add(new UiNode.Iteration(f.variable, f.range.trim(), body));
            }
        }
    }

    private void collectCall(SourceExpr.Call call, List<UiNode> out) {
        String name = ComposeNames.simpleName(call.callee);
        if (ComposeNames.isTransparentScope(name)) {
            for (SourceExpr.Lambda l : call.trailingLambdas) collect(l.body, out);
            return;
        }
        if (ComposeNames.ITERATION_BUILDERS.contains(name)) {
            UiNode iteration = iteration(call, name);
            if (iteration != null) out.add(iteration);
            return;
        }
        if (ComposeNames.isWidget(name)) {
            out.add(widget(call, name));
        }
    }

    private void collectWhen(SourceExpr.When w, List<UiNode> out) {
        List<UiNode.Branch> branches = new ArrayList<>();
        boolean any = false;
        for (SourceExpr.WhenEntry e : w.entries) {
            List<UiNode> nodes = extractNodes(e.body);
            any |= !nodes.isEmpty();
            branches.add(new UiNode.Branch(String.join(", ", e.conditions), e.isElse, nodes));
        }
        if (any) {
            String subject = w.subject == null || w.subject.isBlank() ? null : w.subject.trim();
            out.add(new UiNode.MultiBranch(subject, branches));
        }
    }

    // items(list) { x -> ... } and itemsIndexed(list) { i, x -> ... }
    private UiNode iteration(SourceExpr.Call call, String name) {
        if (call.arguments.isEmpty()) return null;
        SourceExpr.Lambda body = call.trailingLambdas.isEmpty() ? null : call.trailingLambdas.get(0);
        if (body == null) {
            for (SourceExpr.Argument a : call.arguments) {
                if (a.value instanceof SourceExpr.Lambda l) body = l;
            }
        }
        if (body == null) return null;
        List<UiNode> children = extractNodes(body.body);
        if (children.isEmpty()) return null;
        int variableIndex = "itemsIndexed".equals(name) ? 1 : 0;
        String variable = body.parameters.size() > variableIndex ? body.parameters.get(variableIndex) : null;
        return new UiNode.Iteration(variable, call.arguments.get(0).value.text.trim(), children);
    }

    private UiNode.Widget widget(SourceExpr.Call call, String name) {
        SourceExpr.Argument style = ModifierChainExtractor.styleArgument(call);
        List<ModifierDirective> modifiers = ModifierChainExtractor.extract(call);

        Map<String, ArgumentValue> arguments = new LinkedHashMap<>();
        List<UiNode> children = new ArrayList<>();
        for (int i = 0; i < call.arguments.size(); i++) {
            SourceExpr.Argument a = call.arguments.get(i);
            if (a == style) continue;
            if (ComposeNames.CONTENT_ARGUMENT.equals(a.name)) {
                if (a.value instanceof SourceExpr.Lambda l) children.addAll(extractNodes(l.body));
                continue;
            }
            String key = a.name != null ? a.name : "arg" + i;
            arguments.put(key, classifier.classify(a.value));
        }
        for (SourceExpr.Lambda l : call.trailingLambdas) {
            children.addAll(extractNodes(l.body));
        }
        return new UiNode.Widget(name, arguments, modifiers, children);
    }
}
