package info.isaksson.erland.composetoflutter.ir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed type text: base name, nullability, generic arguments and function signature.
 *
 * <p>Parsing is lenient and never throws. Anything that does not look like a generic or a
 * function type is kept whole as the base name.</p>
 */
public final class TypeDescriptor {

    public final String base;
    public final boolean nullable;
    public final List<TypeDescriptor> arguments;

    /** Function types only: parameter types and return type. Null {@code returnType} means not a function. */
    public final List<TypeDescriptor> functionParameters;
    public final TypeDescriptor returnType;

    private TypeDescriptor(String base, boolean nullable, List<TypeDescriptor> arguments,
                           List<TypeDescriptor> functionParameters, TypeDescriptor returnType) {
        this.base = base == null ? "" : base;
        this.nullable = nullable;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
        this.functionParameters = functionParameters == null ? List.of() : List.copyOf(functionParameters);
        this.returnType = returnType;
    }

    public static TypeDescriptor named(String base) {
        return new TypeDescriptor(base, false, null, null, null);
    }

    public static TypeDescriptor generic(String base, List<TypeDescriptor> arguments, boolean nullable) {
        return new TypeDescriptor(base, nullable, arguments, null, null);
    }

    public static TypeDescriptor function(List<TypeDescriptor> parameters, TypeDescriptor returnType, boolean nullable) {
        return new TypeDescriptor("", nullable, null, parameters, Objects.requireNonNull(returnType, "returnType"));
    }

    public boolean isFunction() {
        return returnType != null;
    }

    public TypeDescriptor withNullable(boolean value) {
        return new TypeDescriptor(base, value, arguments, functionParameters, returnType);
    }

    /** Last segment of a qualified base name. */
    public String simpleBase() {
        int dot = base.lastIndexOf('.');
        return dot >= 0 ? base.substring(dot + 1) : base;
    }

    /** Every base name in this descriptor, depth-first, without duplicates. */
    public Set<String> referencedNames() {
        Set<String> out = new LinkedHashSet<>();
        collect(out);
        return out;
    }

    private void collect(Set<String> out) {
        if (isFunction()) {
            for (TypeDescriptor p : functionParameters) p.collect(out);
            returnType.collect(out);
            return;
        }
        if (!base.isEmpty()) out.add(base);
        for (TypeDescriptor a : arguments) a.collect(out);
    }

    public static TypeDescriptor parse(String text) {
        String s = text == null ? "" : text.trim();
        boolean nullable = false;
        if (s.endsWith("?")) {
            nullable = true;
            s = s.substring(0, s.length() - 1).trim();
        }
        if (s.startsWith("(") && closingParen(s, 0) == s.length() - 1) {
            // Parenthesized, typically a nullable function type.
            TypeDescriptor inner = parse(s.substring(1, s.length() - 1));
            return nullable ? inner.withNullable(true) : inner;
        }
        if (s.startsWith("suspend ")) {
            s = s.substring("suspend ".length()).trim();
        }

        int arrow = topLevelArrow(s);
        if (arrow >= 0) {
            String left = s.substring(0, arrow).trim();
            String right = s.substring(arrow + 2).trim();
            int open = left.indexOf('(');
            List<TypeDescriptor> params = new ArrayList<>();
            if (open >= 0 && left.endsWith(")")) {
                for (String p : splitTopLevel(left.substring(open + 1, left.length() - 1))) {
                    params.add(parse(stripParameterName(p)));
                }
            }
            return function(params, parse(right), nullable);
        }

        int lt = s.indexOf('<');
        if (lt > 0 && s.endsWith(">")) {
            String base = s.substring(0, lt).trim();
            List<TypeDescriptor> args = new ArrayList<>();
            for (String a : splitTopLevel(s.substring(lt + 1, s.length() - 1))) {
                args.add(parse(stripVariance(a)));
            }
            return generic(base, args, nullable);
        }
        return new TypeDescriptor(s, nullable, null, null, null);
    }

    /** Source-side rendering, e.g. {@code Map<String, List<Int>>?} or {@code ((Int) -> Unit)?}. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (isFunction()) {
            if (nullable) sb.append('(');
            sb.append('(');
            for (int i = 0; i < functionParameters.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(functionParameters.get(i).render());
            }
            sb.append(") -> ").append(returnType.render());
            if (nullable) sb.append(")?");
            return sb.toString();
        }
        sb.append(base);
        if (!arguments.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(arguments.get(i).render());
            }
            sb.append('>');
        }
        if (nullable) sb.append('?');
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    /** Split on commas that are not nested inside angle brackets or parentheses. */
    public static List<String> splitTopLevel(String s) {
        List<String> out = new ArrayList<>();
        if (s == null || s.isBlank()) return out;
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '(' || c == '[') depth++;
            else if (c == '>' && !(i > 0 && s.charAt(i - 1) == '-')) depth--;
            else if (c == ')' || c == ']') depth--;
            else if (c == ',' && depth == 0) {
                out.add(s.substring(start, i).trim());
                start = i + 1;
            }
        }
        String last = s.substring(start).trim();
        if (!last.isEmpty()) out.add(last);
        return out;
    }

    private static int topLevelArrow(String s) {
        int depth = 0;
        for (int i = 0; i < s.length() - 1; i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '(') depth++;
            else if (c == ')') depth--;
            else if (c == '>' && (i == 0 || s.charAt(i - 1) != '-')) depth--;
            else if (c == '-' && s.charAt(i + 1) == '>' && depth == 0) return i;
        }
        return -1;
    }

    private static int closingParen(String s, int open) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static String stripVariance(String arg) {
        String a = arg.trim();
        if (a.startsWith("out ")) return a.substring(4).trim();
        if (a.startsWith("in ")) return a.substring(3).trim();
        return a;
    }

    // (name: Type) -> R is allowed in function types
    private static String stripParameterName(String p) {
        int colon = p.indexOf(':');
        int lt = p.indexOf('<');
        if (colon > 0 && (lt < 0 || lt > colon) && p.substring(0, colon).trim().matches("[A-Za-z_][A-Za-z0-9_]*")) {
            return p.substring(colon + 1).trim();
        }
        return p;
    }
}
