package info.isaksson.erland.composetoflutter.dart;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Formats {@link DartExpr} trees.
 *
 * <p>An expression is printed on one line when that line fits the page width; otherwise
 * argument lists and list literals break one entry per line with trailing commas. The first
 * line of the result carries no indentation; later lines are indented absolutely.</p>
 */
public final class DartPrinter {

    public static final int DEFAULT_WIDTH = 80;
    private static final String INDENT = "  ";

    private final int width;

    public DartPrinter() {
        this(DEFAULT_WIDTH);
    }

    public DartPrinter(int width) {
        this.width = width;
    }

    public String print(DartExpr expr) {
        return print(expr, 0);
    }

    public String print(DartExpr expr, int indent) {
        String flat = flat(expr);
        if (flat != null && indent * INDENT.length() + flat.length() <= width) {
            return flat;
        }
        return broken(expr, indent);
    }

    /** Single-line form, or null when the expression cannot be flattened. */
    String flat(DartExpr expr) {
        if (expr instanceof DartExpr.Code c) {
            return c.text.indexOf('\n') >= 0 ? null : c.text;
        }
        if (expr instanceof DartExpr.Call c) {
            List<String> parts = new ArrayList<>();
            for (DartExpr p : c.positional) {
                String s = flat(p);
                if (s == null) return null;
                parts.add(s);
            }
            for (Map.Entry<String, DartExpr> e : c.named.entrySet()) {
                String s = flat(e.getValue());
                if (s == null) return null;
                parts.add(e.getKey() + ": " + s);
            }
            return (c.constant ? "const " : "") + c.callee + "(" + String.join(", ", parts) + ")";
        }
        if (expr instanceof DartExpr.ListLiteral l) {
            List<String> parts = new ArrayList<>();
            for (DartExpr item : l.items) {
                String s = flat(item);
                if (s == null) return null;
                parts.add(s);
            }
            return (l.constant ? "const " : "") + "[" + String.join(", ", parts) + "]";
        }
        if (expr instanceof DartExpr.Ternary t) {
            String a = flat(t.whenTrue);
            String b = flat(t.whenFalse);
            if (a == null || b == null) return null;
            return t.condition + " ? " + a + " : " + b;
        }
        if (expr instanceof DartExpr.Spread s) {
            String body = flat(s.body);
            if (body == null) return null;
            return "..." + s.source + ".map((" + s.variable + ") => " + body + ")";
        }
        if (expr instanceof DartExpr.Callback cb) {
            String params = "(" + String.join(", ", cb.parameters) + ")";
            if (cb.statements.isEmpty()) {
                if (cb.result == null) return params + " {}";
                String r = flat(cb.result);
                return r == null ? null : params + " => " + r;
            }
            if (cb.result != null || cb.statements.size() > 1) return null;
            String stmt = cb.statements.get(0);
            if (stmt.indexOf('\n') >= 0) return null;
            return params + " { " + terminated(stmt) + " }";
        }
        throw new IllegalArgumentException("unknown expression: " + expr);
    }

    private String broken(DartExpr expr, int indent) {
        String pad = pad(indent);
        String inner = pad(indent + 1);
        if (expr instanceof DartExpr.Code c) {
            return reindent(c.text, pad);
        }
        if (expr instanceof DartExpr.Call c) {
            StringBuilder sb = new StringBuilder();
            if (c.constant) sb.append("const ");
            sb.append(c.callee).append("(");
            if (!c.hasArguments()) return sb.append(")").toString();
            sb.append('\n');
            for (DartExpr p : c.positional) {
                sb.append(inner).append(print(p, indent + 1)).append(",\n");
            }
            for (Map.Entry<String, DartExpr> e : c.named.entrySet()) {
                sb.append(inner).append(e.getKey()).append(": ").append(print(e.getValue(), indent + 1)).append(",\n");
            }
            return sb.append(pad).append(")").toString();
        }
        if (expr instanceof DartExpr.ListLiteral l) {
            StringBuilder sb = new StringBuilder();
            if (l.constant) sb.append("const ");
            sb.append("[");
            if (l.items.isEmpty()) return sb.append("]").toString();
            sb.append('\n');
            for (DartExpr item : l.items) {
                sb.append(inner).append(print(item, indent + 1)).append(",\n");
            }
            return sb.append(pad).append("]").toString();
        }
        if (expr instanceof DartExpr.Ternary t) {
            String deeper = pad(indent + 2);
            return t.condition + "\n"
                    + deeper + "? " + print(t.whenTrue, indent + 2) + "\n"
                    + deeper + ": " + print(t.whenFalse, indent + 2);
        }
        if (expr instanceof DartExpr.Spread s) {
            return "..." + s.source + ".map((" + s.variable + ") => " + print(s.body, indent) + ")";
        }
        if (expr instanceof DartExpr.Callback cb) {
            String params = "(" + String.join(", ", cb.parameters) + ")";
            if (cb.statements.isEmpty() && cb.result != null) {
                return params + " => " + print(cb.result, indent);
            }
            StringBuilder sb = new StringBuilder(params).append(" {\n");
            for (String s : cb.statements) {
                sb.append(inner).append(reindent(terminated(s), inner)).append('\n');
            }
            if (cb.result != null) {
                sb.append(inner).append("return ").append(print(cb.result, indent + 1)).append(";\n");
            }
            return sb.append(pad).append("}").toString();
        }
        throw new IllegalArgumentException("unknown expression: " + expr);
    }

    private static String terminated(String statement) {
        String s = statement.trim();
        return s.endsWith(";") || s.endsWith("}") ? s : s + ";";
    }

    private static String reindent(String text, String pad) {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            sb.append('\n');
            if (!lines[i].isEmpty()) sb.append(pad).append(lines[i]);
        }
        return sb.toString();
    }

    private static String pad(int indent) {
        return INDENT.repeat(indent);
    }
}
