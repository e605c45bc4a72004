package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.dart.DartExpr;
import info.isaksson.erland.composetoflutter.ir.ArgumentValue;
import info.isaksson.erland.composetoflutter.ir.TypeDescriptor;
import info.isaksson.erland.composetoflutter.ir.UiNode;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders widget argument values as target expressions.
 *
 * <p>Literals and references go through the component's {@link ExpressionRewriter}. Closures
 * that contain UI render as widgets; other closures become callbacks, wrapped in
 * {@code setState} when they write a state variable.</p>
 */
final class ArgumentRenderer {

    /** Event arguments whose callback receives the new value. */
    static final Set<String> VALUE_CALLBACKS = Set.of("onValueChange", "onCheckedChange", "onChanged", "onSelectedChange");

    private static final Pattern LAMBDA_PARAMETERS = Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*(?:\\s*:\\s*[^,>-]+)?(?:\\s*,\\s*[A-Za-z_][A-Za-z0-9_]*(?:\\s*:\\s*[^,>-]+)?)*)\\s*->");
    private static final Pattern ROUNDED_CORNERS = Pattern.compile("^RoundedCornerShape\\((.*)\\)$");
    private static final Pattern NAMED_ARGUMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*=(?!=)\\s*(.*)$", Pattern.DOTALL);

    private final ComponentScope scope;
    private final GenerationContext ctx;
    private final Function<List<UiNode>, DartExpr> group;

    ArgumentRenderer(ComponentScope scope, GenerationContext ctx, Function<List<UiNode>, DartExpr> group) {
        this.scope = scope;
        this.ctx = ctx;
        this.group = group;
    }

    ExpressionRewriter rewriter() {
        return scope.rewriter;
    }

    /** Target expression for any argument value; null for a missing argument. */
    DartExpr value(ArgumentValue v) {
        if (v == null) return null;
        if (v instanceof ArgumentValue.Closure c) {
            return c.nodes.isEmpty() ? callback(c, 0) : group.apply(c.nodes);
        }
        return new DartExpr.Code(code(v));
    }

    /** Rewritten target text of a non-closure value. */
    String code(ArgumentValue v) {
        if (v == null) return "null";
        if (v instanceof ArgumentValue.StringValue
                || v instanceof ArgumentValue.IntValue
                || v instanceof ArgumentValue.BoolValue
                || v instanceof ArgumentValue.NullValue) {
            return scope.rewriter.rewrite(v.text());
        }
        if (v instanceof ArgumentValue.DoubleValue d) {
            return Double.toString(d.value);
        }
        if (v instanceof ArgumentValue.Reference r) {
            return reference(r.name);
        }
        if (v instanceof ArgumentValue.CallValue c) {
            return call(c);
        }
        return scope.rewriter.rewrite(v.text());
    }

    /** Slot content: a closure's UI, or the value itself when it is not a closure. */
    DartExpr slot(ArgumentValue v) {
        if (v instanceof ArgumentValue.Closure c) {
            return c.nodes.isEmpty() ? null : group.apply(c.nodes);
        }
        return value(v);
    }

    /** Event handler for an argument; an empty handler when the value is not a closure. */
    DartExpr callback(ArgumentValue v, int arity) {
        if (v instanceof ArgumentValue.Closure c) {
            return callback(c.parameters, c.statements, arity);
        }
        if (v == null) return DartExpr.Callback.block(defaultParameters(arity), List.of());
        // A function reference passes through unchanged.
        return new DartExpr.Code(code(v));
    }

    DartExpr callback(ArgumentValue.Closure c, int arity) {
        return callback(c.parameters, c.statements, arity);
    }

    /** Event handler from raw closure text such as {@code { x -> go(x) }}. */
    DartExpr callbackFromSource(String text, int arity) {
        String body = text == null ? "" : text.trim();
        if (!body.startsWith("{")) {
            if (body.isEmpty()) return DartExpr.Callback.block(defaultParameters(arity), List.of());
            return new DartExpr.Code(scope.rewriter.rewrite(body));
        }
        body = body.substring(1, body.endsWith("}") ? body.length() - 1 : body.length());
        List<String> parameters = new ArrayList<>();
        Matcher m = LAMBDA_PARAMETERS.matcher(body);
        if (m.find()) {
            for (String p : m.group(1).split(",")) {
                String name = p.trim();
                int colon = name.indexOf(':');
                parameters.add(colon >= 0 ? name.substring(0, colon).trim() : name);
            }
            body = body.substring(m.end());
        }
        return callback(parameters, splitStatements(body), arity);
    }

    static int arity(String argumentName) {
        return VALUE_CALLBACKS.contains(argumentName) ? 1 : 0;
    }

    private DartExpr callback(List<String> sourceParameters, List<String> sourceStatements, int arity) {
        List<String> parameters = sourceParameters.isEmpty() ? defaultParameters(arity) : sourceParameters;
        List<String> statements = new ArrayList<>();
        boolean writesState = false;
        for (String s : sourceStatements) {
            if (s.isBlank()) continue;
            writesState |= scope.stateful && scope.assignsState(s);
            statements.add(statement(s));
        }
        if (statements.isEmpty()) {
            return DartExpr.Callback.block(parameters, List.of());
        }
        if (writesState) {
            StringBuilder sb = new StringBuilder("setState(() {\n");
            for (String s : statements) sb.append("  ").append(terminated(s)).append('\n');
            sb.append("})");
            return DartExpr.Callback.block(parameters, List.of(sb.toString()));
        }
        if (statements.size() == 1 && !isAssignment(statements.get(0))) {
            return DartExpr.Callback.arrow(parameters, new DartExpr.Code(statements.get(0)));
        }
        return DartExpr.Callback.block(parameters, statements);
    }

    private String statement(String source) {
        return scope.rewriter.rewrite(source.trim());
    }

    private static List<String> defaultParameters(int arity) {
        if (arity <= 0) return List.of();
        if (arity == 1) return List.of(UiNode.Iteration.DEFAULT_VARIABLE);
        List<String> out = new ArrayList<>();
        for (int i = 0; i < arity; i++) out.add("arg" + i);
        return out;
    }

    private static boolean isAssignment(String s) {
        return s.matches("(?s)^[A-Za-z_][A-Za-z0-9_.\\[\\]]*\\s*[+\\-*/%?]?=(?!=).*") || s.startsWith("final ") || s.startsWith("var ");
    }

    private static String terminated(String s) {
        String t = s.trim();
        return t.endsWith(";") || t.endsWith("}") ? t : t + ";";
    }

    private String reference(String name) {
        if ("CircleShape".equals(name)) return "const CircleBorder()";
        if ("RectangleShape".equals(name)) return "const RoundedRectangleBorder()";
        return scope.rewriter.rewrite(name);
    }

    private String call(ArgumentValue.CallValue c) {
        String simple = simpleName(c.name);
        Map<String, String> args = argumentMap(c.arguments);
        if (simple.equals("RoundedCornerShape")) {
            return "RoundedRectangleBorder(borderRadius: " + borderRadius(c.source) + ")";
        }
        if (simple.equals("PaddingValues")) {
            return ModifierChainResolver.insets(args, scope.rewriter);
        }
        if (simple.equals("TextStyle")) {
            List<String> parts = new ArrayList<>();
            for (Map.Entry<String, String> e : args.entrySet()) {
                parts.add(e.getKey() + ": " + scope.rewriter.rewrite(e.getValue()));
            }
            return "TextStyle(" + String.join(", ", parts) + ")";
        }
        if (ctx.widgets.isKnown(simple) && c.source.startsWith(c.name + "(")) {
            return scope.rewriter.rewrite(ctx.widgets.widgetName(simple) + c.source.substring(c.name.length()));
        }
        return scope.rewriter.rewrite(c.source);
    }

    /** {@code BorderRadius} for a shape text; circular 8 when the radius cannot be read. */
    String borderRadius(String shapeSource) {
        Matcher m = ROUNDED_CORNERS.matcher(shapeSource == null ? "" : shapeSource.trim());
        if (m.matches()) {
            String inner = m.group(1).trim();
            if (!inner.isEmpty() && !inner.contains("=") && !inner.contains(",")) {
                if (inner.endsWith("%")) return "BorderRadius.circular(8)";
                return "BorderRadius.circular(" + number(scope.rewriter.rewrite(inner)) + ")";
            }
            Map<String, String> args = argumentMap(TypeDescriptor.splitTopLevel(inner));
            String v = args.get("size");
            if (v == null) v = args.get("0");
            if (v != null) return "BorderRadius.circular(" + number(scope.rewriter.rewrite(v)) + ")";
        }
        return "BorderRadius.circular(8)";
    }

    /** Argument texts keyed by name, or by position counting unnamed arguments only. */
    static Map<String, String> argumentMap(List<String> texts) {
        Map<String, String> out = new LinkedHashMap<>();
        int position = 0;
        for (String t : texts) {
            String s = t.trim();
            Matcher m = NAMED_ARGUMENT.matcher(s);
            if (m.matches() && !s.startsWith("{")) {
                out.put(m.group(1), m.group(2).trim());
            } else {
                out.put(Integer.toString(position++), s);
            }
        }
        return out;
    }

    /** Top-level statements of a closure body. */
    static List<String> splitStatements(String body) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (inString) {
                cur.append(c);
                if (c == '\\' && i + 1 < body.length()) {
                    cur.append(body.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') inString = true;
            if (c == '(' || c == '[' || c == '{') depth++;
            if (c == ')' || c == ']' || c == '}') depth--;
            if (depth == 0 && (c == ';' || c == '\n')) {
                if (!cur.toString().isBlank()) out.add(cur.toString().trim());
                cur.setLength(0);
                continue;
            }
            cur.append(c);
        }
        if (!cur.toString().isBlank()) out.add(cur.toString().trim());
        return out;
    }

    /** Numeric text without a float suffix. */
    static String number(String text) {
        String t = text.trim();
        if (t.matches("-?\\d+(\\.\\d+)?[fF]")) return t.substring(0, t.length() - 1);
        return t;
    }

    private static String simpleName(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }
}
