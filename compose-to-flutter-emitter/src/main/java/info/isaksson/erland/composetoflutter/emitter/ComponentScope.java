package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.ir.SourceParameter;
import info.isaksson.erland.composetoflutter.ir.StateVariable;
import info.isaksson.erland.composetoflutter.ir.UiTree;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/** Names visible while rendering one component: its state variables and its fields. */
final class ComponentScope {

    static final String STYLE_PARAMETER = "modifier";

    private static final String MUTATORS = "add|addAll|remove|removeAt|removeAll|removeIf|removeWhere|clear|set|put|putAll|sort|shuffle|insert|retainAll";

    final UiTree tree;
    final boolean stateful;
    final ExpressionRewriter rewriter;

    private final Set<String> stateNames = new LinkedHashSet<>();
    private final Set<String> fields = new LinkedHashSet<>();

    ComponentScope(UiTree tree) {
        this.tree = tree;
        this.stateful = tree.isStateful();
        for (StateVariable v : tree.state) stateNames.add(v.name);
        for (SourceParameter p : tree.parameters) {
            if (!STYLE_PARAMETER.equals(p.name)) fields.add(p.name);
        }
        // Stateless builds read fields directly; only a State class goes through widget.
        this.rewriter = new ExpressionRewriter(stateNames, stateful ? fields : null);
    }

    Set<String> fields() {
        return fields;
    }

    /** True when the statement writes a state variable, directly or through a collection mutator. */
    boolean assignsState(String statement) {
        if (statement == null) return false;
        String s = statement.trim();
        for (String name : stateNames) {
            String q = Pattern.quote(name);
            if (Pattern.compile("^" + q + "(?:\\.value)?\\s*(?:[+\\-*/%]?=(?!=)|\\+\\+|--)").matcher(s).find()) return true;
            if (Pattern.compile("^(?:\\+\\+|--)" + q + "\\b").matcher(s).find()) return true;
            if (Pattern.compile("^" + q + "\\s*\\[[^\\]]*\\]\\s*=(?!=)").matcher(s).find()) return true;
            if (Pattern.compile("^" + q + "\\.(?:" + MUTATORS + ")\\s*\\(").matcher(s).find()) return true;
        }
        return false;
    }
}
