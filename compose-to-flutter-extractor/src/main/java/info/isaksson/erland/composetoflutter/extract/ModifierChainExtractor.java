package info.isaksson.erland.composetoflutter.extract;

import info.isaksson.erland.composetoflutter.ir.ModifierDirective;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decomposes a style chain such as {@code Modifier.padding(8.dp).clickable { go() }} into
 * directives, left to right.
 */
final class ModifierChainExtractor {

    private ModifierChainExtractor() {}

    /**
     * The call's style argument: the one named {@code modifier}, else the first unnamed argument
     * whose chain is rooted at {@code Modifier}. Null if there is none.
     */
    static SourceExpr.Argument styleArgument(SourceExpr.Call call) {
        for (SourceExpr.Argument a : call.arguments) {
            if (ComposeNames.MODIFIER_ARGUMENT.equals(a.name)) return a;
        }
        for (SourceExpr.Argument a : call.arguments) {
            if (a.name == null && isRootedAtModifier(a.value)) return a;
        }
        return null;
    }

    static List<ModifierDirective> extract(SourceExpr.Call call) {
        SourceExpr.Argument arg = styleArgument(call);
        List<ModifierDirective> out = new ArrayList<>();
        if (arg != null) walk(arg.value, out);
        return out;
    }

    static void walk(SourceExpr expr, List<ModifierDirective> out) {
        if (expr instanceof SourceExpr.Qualified q) {
            walk(q.receiver, out);
            if (q.selector instanceof SourceExpr.Call c) {
                out.add(directive(c));
            }
        } else if (expr instanceof SourceExpr.Call c) {
            if (!ComposeNames.MODIFIER.equals(c.callee)) out.add(directive(c));
        }
    }

    static boolean isRootedAtModifier(SourceExpr expr) {
        SourceExpr e = expr;
        while (e instanceof SourceExpr.Qualified q) {
            e = q.receiver;
        }
        if (e instanceof SourceExpr.NameRef n) return ComposeNames.MODIFIER.equals(n.name);
        return ComposeNames.MODIFIER.equals(e.text.trim());
    }

    // Named arguments keep their name; unnamed ones (trailing closures included) are numbered.
    private static ModifierDirective directive(SourceExpr.Call c) {
        Map<String, String> args = new LinkedHashMap<>();
        int position = 0;
        for (SourceExpr.Argument a : c.arguments) {
            if (a.name != null) {
                args.put(a.name, a.value.text.trim());
            } else {
                args.put(Integer.toString(position++), a.value.text.trim());
            }
        }
        for (SourceExpr.Lambda l : c.trailingLambdas) {
            args.put(Integer.toString(position++), l.text.trim());
        }
        return new ModifierDirective(c.callee, args);
    }
}
