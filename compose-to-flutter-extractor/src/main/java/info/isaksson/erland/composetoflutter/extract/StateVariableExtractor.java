package info.isaksson.erland.composetoflutter.extract;

import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import info.isaksson.erland.composetoflutter.ir.StateFlavor;
import info.isaksson.erland.composetoflutter.ir.StateVariable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds reactive state declared directly in a component body.
 *
 * <p>Only top-level bindings of the body block are inspected. Markers are checked in a fixed
 * order, so {@code rememberSaveable { mutableStateOf(0) }} is persisted state while
 * {@code rememberSaveable { mutableStateListOf<String>() }} stays a list cell.</p>
 */
final class StateVariableExtractor {

    private static final String[] PLAIN_MARKERS = {
            "mutableStateOf", "mutableIntStateOf", "mutableLongStateOf",
            "mutableFloatStateOf", "mutableDoubleStateOf"
    };
    private static final String[] STREAM_MARKERS = {
            "collectAsStateWithLifecycle", "collectAsState", "observeAsState", "produceState"
    };

    private static final Pattern INT = Pattern.compile("-?\\d+");
    private static final Pattern LONG = Pattern.compile("-?\\d+[lL]");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d*\\.\\d+[fF]?|-?\\d+[fF]");

    private StateVariableExtractor() {}

    static List<StateVariable> extract(SourceExpr body) {
        List<StateVariable> out = new ArrayList<>();
        if (!(body instanceof SourceExpr.Block block)) return out;
        for (SourceExpr stmt : block.statements) {
            if (!(stmt instanceof SourceExpr.Binding b) || b.initializer == null) continue;
            String init = b.initializer.text;
            StateFlavor flavor = detectFlavor(init);
            if (flavor == null) continue;
            String initialValue = initialValue(init, flavor);
            String type = b.type != null && !b.type.isBlank() ? b.type : inferType(init, flavor, initialValue);
            out.add(new StateVariable(b.name, type, flavor, init, initialValue));
        }
        return out;
    }

    static StateFlavor detectFlavor(String init) {
        if (init == null) return null;
        // Saved collection cells keep their cell flavor; it carries the element type and contents.
        if (init.contains("mutableStateListOf")) return StateFlavor.LIST_CELL;
        if (init.contains("mutableStateMapOf")) return StateFlavor.MAP_CELL;
        if (init.contains("rememberSaveable")) return StateFlavor.PERSISTED;
        if (init.contains("derivedStateOf")) return StateFlavor.DERIVED;
        for (String m : STREAM_MARKERS) {
            if (init.contains(m)) return StateFlavor.STREAM_PROJECTED;
        }
        for (String m : PLAIN_MARKERS) {
            if (init.contains(m)) return StateFlavor.PLAIN;
        }
        return null;
    }

    static String initialValue(String init, StateFlavor flavor) {
        switch (flavor) {
            case LIST_CELL:
                return callArguments(init, "mutableStateListOf");
            case MAP_CELL:
                return callArguments(init, "mutableStateMapOf");
            case DERIVED:
                return null;
            case STREAM_PROJECTED: {
                for (String m : STREAM_MARKERS) {
                    String args = callArguments(init, m);
                    if (args != null) {
                        // collectAsState(initial = x) -> x
                        int eq = args.indexOf('=');
                        return eq > 0 && args.substring(0, eq).trim().matches("[A-Za-z_]+") ? args.substring(eq + 1).trim() : args;
                    }
                }
                return null;
            }
            default: {
                for (String m : PLAIN_MARKERS) {
                    String args = callArguments(init, m);
                    if (args != null) return args;
                }
                return null;
            }
        }
    }

    static String inferType(String init, StateFlavor flavor, String initialValue) {
        if (flavor == StateFlavor.LIST_CELL) return "MutableList" + explicitTypeArgument(init, "mutableStateListOf");
        if (flavor == StateFlavor.MAP_CELL) return "MutableMap" + explicitTypeArgument(init, "mutableStateMapOf");
        for (String m : PLAIN_MARKERS) {
            String explicit = explicitTypeArgument(init, m);
            if (!explicit.isEmpty()) return explicit.substring(1, explicit.length() - 1);
        }
        if (init.contains("mutableIntStateOf")) return "Int";
        if (init.contains("mutableLongStateOf")) return "Long";
        if (init.contains("mutableFloatStateOf")) return "Float";
        if (init.contains("mutableDoubleStateOf")) return "Double";
        if (initialValue == null) return StateVariable.UNTYPED;
        String v = initialValue.trim();
        if (v.equals("true") || v.equals("false")) return "Boolean";
        if (INT.matcher(v).matches()) return "Int";
        if (LONG.matcher(v).matches()) return "Long";
        if (DECIMAL.matcher(v).matches()) return "Double";
        if (v.startsWith("\"") && v.endsWith("\"")) return "String";
        if (v.startsWith("listOf(") || v.startsWith("emptyList")) return "List";
        return StateVariable.UNTYPED;
    }

    /** Text between the parentheses of the first {@code name(...)} call, or null. */
    static String callArguments(String text, String name) {
        int idx = indexOfCall(text, name);
        if (idx < 0) return null;
        int open = text.indexOf('(', idx + name.length());
        if (open < 0) return null;
        int depth = 0;
        boolean inString = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) inString = !inString;
            if (inString) continue;
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) return text.substring(open + 1, i).trim();
            }
        }
        return null;
    }

    /** {@code "<T>"} for {@code name<T>(...)}, else empty. */
    private static String explicitTypeArgument(String text, String name) {
        int idx = indexOfCall(text, name);
        if (idx < 0) return "";
        int lt = idx + name.length();
        if (lt >= text.length() || text.charAt(lt) != '<') return "";
        int depth = 0;
        for (int i = lt; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') depth++;
            else if (c == '>') {
                depth--;
                if (depth == 0) return text.substring(lt, i + 1);
            }
        }
        return "";
    }

    // Whole-word match so mutableStateOf does not match inside mutableIntStateOf.
    private static int indexOfCall(String text, String name) {
        int from = 0;
        while (true) {
            int idx = text.indexOf(name, from);
            if (idx < 0) return -1;
            boolean startOk = idx == 0 || !Character.isJavaIdentifierPart(text.charAt(idx - 1));
            int end = idx + name.length();
            boolean endOk = end >= text.length() || !Character.isJavaIdentifierPart(text.charAt(end));
            if (startOk && endOk) return idx;
            from = idx + 1;
        }
    }
}
