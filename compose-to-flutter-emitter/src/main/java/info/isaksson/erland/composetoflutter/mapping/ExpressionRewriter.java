package info.isaksson.erland.composetoflutter.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites source expression text into target expression text.
 *
 * <p>The rewrite is textual and best-effort: string literals are requoted, framework constants
 * are renamed, unit suffixes are dropped and a few operators and collection builders are
 * translated. State reads lose their {@code .value} accessor and, inside a state class,
 * component parameters are read through {@code widget.}.</p>
 */
public final class ExpressionRewriter {

    private static final Pattern UNIT_SUFFIX = Pattern.compile("\\.(?:dp|sp)\\b(?!\\s*\\()");
    private static final Pattern NUMBER_SUFFIX = Pattern.compile("(?<![\\w.])(\\d+(?:\\.\\d+)?)[fFL]\\b");
    private static final Pattern COLOR = Pattern.compile("\\bColor\\.([A-Z][A-Za-z0-9]*)");
    private static final Pattern ALIGNMENT = Pattern.compile("\\bAlignment\\.([A-Z][A-Za-z]*)");
    private static final Pattern ARRANGEMENT = Pattern.compile("\\bArrangement\\.([A-Z][A-Za-z]*)");
    private static final Pattern FONT_WEIGHT = Pattern.compile("\\bFontWeight\\.([A-Z][A-Za-z]*)");
    private static final Pattern TEXT_ALIGN = Pattern.compile("\\bTextAlign\\.([A-Z][A-Za-z]*)");
    private static final Pattern CONTENT_SCALE = Pattern.compile("\\bContentScale\\.([A-Z][A-Za-z]*)");
    private static final Pattern ICON = Pattern.compile(
            "\\bIcons\\.(?:AutoMirrored\\.)?(Default|Filled|Outlined|Rounded|Sharp|TwoTone)\\.([A-Z][A-Za-z0-9]*)");
    private static final Pattern RANGE = Pattern.compile("^(.+?)\\s*(\\.\\.|\\buntil\\b)\\s*(.+)$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    static final Map<String, String> COLORS = Map.ofEntries(
            Map.entry("Gray", "grey"),
            Map.entry("LightGray", "grey"),
            Map.entry("DarkGray", "grey"),
            Map.entry("Unspecified", "transparent")
    );

    static final Map<String, String> ALIGNMENTS = Map.ofEntries(
            Map.entry("TopStart", "topLeft"),
            Map.entry("TopCenter", "topCenter"),
            Map.entry("TopEnd", "topRight"),
            Map.entry("CenterStart", "centerLeft"),
            Map.entry("Center", "center"),
            Map.entry("CenterEnd", "centerRight"),
            Map.entry("BottomStart", "bottomLeft"),
            Map.entry("BottomCenter", "bottomCenter"),
            Map.entry("BottomEnd", "bottomRight"),
            Map.entry("Start", "centerLeft"),
            Map.entry("End", "centerRight"),
            Map.entry("Top", "topCenter"),
            Map.entry("Bottom", "bottomCenter"),
            Map.entry("CenterHorizontally", "center"),
            Map.entry("CenterVertically", "center")
    );

    static final Map<String, String> ARRANGEMENTS = Map.ofEntries(
            Map.entry("SpaceBetween", "spaceBetween"),
            Map.entry("SpaceAround", "spaceAround"),
            Map.entry("SpaceEvenly", "spaceEvenly"),
            Map.entry("Center", "center"),
            Map.entry("End", "end"),
            Map.entry("Bottom", "end"),
            Map.entry("Start", "start"),
            Map.entry("Top", "start")
    );

    static final Map<String, String> FONT_WEIGHTS = Map.ofEntries(
            Map.entry("Bold", "bold"),
            Map.entry("Normal", "normal"),
            Map.entry("Thin", "w100"),
            Map.entry("ExtraLight", "w200"),
            Map.entry("Light", "w300"),
            Map.entry("Medium", "w500"),
            Map.entry("SemiBold", "w600"),
            Map.entry("ExtraBold", "w800"),
            Map.entry("Black", "w900")
    );

    static final Map<String, String> CONTENT_SCALES = Map.ofEntries(
            Map.entry("Crop", "cover"),
            Map.entry("Fit", "contain"),
            Map.entry("FillBounds", "fill"),
            Map.entry("FillWidth", "fitWidth"),
            Map.entry("FillHeight", "fitHeight"),
            Map.entry("Inside", "scaleDown"),
            Map.entry("None", "none")
    );

    private final Set<String> stateNames;
    private final Set<String> widgetFields;

    public ExpressionRewriter(Set<String> stateNames, Set<String> widgetFields) {
        this.stateNames = stateNames == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(stateNames));
        this.widgetFields = widgetFields == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(widgetFields));
    }

    /** Rewriter without component scope. */
    public static ExpressionRewriter plain() {
        return new ExpressionRewriter(null, null);
    }

    public Set<String> stateNames() {
        return stateNames;
    }

    public boolean isStateName(String name) {
        return stateNames.contains(name);
    }

    public String rewrite(String source) {
        if (source == null) return "";
        List<String> strings = new ArrayList<>();
        String code = extractStrings(source.trim(), strings);

        for (String s : stateNames) {
            code = code.replaceAll("\\b" + Pattern.quote(s) + "\\.value\\b", Matcher.quoteReplacement(s));
        }
        for (String f : widgetFields) {
            if (stateNames.contains(f)) continue;
            code = code.replaceAll("(?<![\\w.$])" + Pattern.quote(f) + "\\b(?!\\s*=(?!=))", "widget." + Matcher.quoteReplacement(f));
        }
        code = code.replace("!!", "!").replace("?:", "??");
        code = rewriteConstants(code);
        code = code.replaceAll("\\bprintln\\(", "print(");
        code = code.replaceAll("\\bval\\s+", "final ");
        code = code.replaceAll("\\b(?:emptyList|mutableListOf|arrayListOf|mutableStateListOf)\\(\\s*\\)", "[]");
        code = code.replaceAll("\\b(?:emptyMap|mutableMapOf|hashMapOf|mutableStateMapOf)\\(\\s*\\)", "{}");
        code = code.replaceAll("\\b(?:emptySet|mutableSetOf)\\(\\s*\\)", "<dynamic>{}");
        code = replaceCall(code, "listOf", "[", "]");
        code = replaceCall(code, "mutableListOf", "[", "]");
        code = replaceCall(code, "arrayListOf", "[", "]");
        code = replaceCall(code, "setOf", "{", "}");
        code = namedArgumentsToColons(code);

        return restoreStrings(code, strings);
    }

    /** Framework constants only; used for references that are not full expressions. */
    public static String rewriteConstants(String code) {
        String out = UNIT_SUFFIX.matcher(code).replaceAll("");
        out = NUMBER_SUFFIX.matcher(out).replaceAll("$1");
        out = replaceEach(out, ICON, m -> {
            String style = m.group(1);
            String name = snakeCase(m.group(2));
            String suffix = "";
            if (style.equals("Outlined")) suffix = "_outlined";
            else if (style.equals("Rounded")) suffix = "_rounded";
            else if (style.equals("Sharp")) suffix = "_sharp";
            return "Icons." + name + suffix;
        });
        out = replaceEach(out, COLOR, m -> "Colors." + COLORS.getOrDefault(m.group(1), lowerFirst(m.group(1))));
        out = replaceEach(out, ALIGNMENT, m -> "Alignment." + ALIGNMENTS.getOrDefault(m.group(1), lowerFirst(m.group(1))));
        out = replaceEach(out, ARRANGEMENT, m -> "MainAxisAlignment." + ARRANGEMENTS.getOrDefault(m.group(1), lowerFirst(m.group(1))));
        out = replaceEach(out, FONT_WEIGHT, m -> "FontWeight." + FONT_WEIGHTS.getOrDefault(m.group(1), lowerFirst(m.group(1))));
        out = replaceEach(out, TEXT_ALIGN, m -> "TextAlign." + lowerFirst(m.group(1)));
        out = replaceEach(out, CONTENT_SCALE, m -> "BoxFit." + CONTENT_SCALES.getOrDefault(m.group(1), lowerFirst(m.group(1))));
        out = out.replace("MaterialTheme.colorScheme", "Theme.of(context).colorScheme");
        out = out.replace("MaterialTheme.typography", "Theme.of(context).textTheme");
        out = out.replace("MaterialTheme.shapes", "Theme.of(context)");
        return out;
    }

    /** Target iteration source; integer ranges become {@code List.generate}. */
    public String iterationSource(String source) {
        String s = source == null ? "" : source.trim();
        Matcher m = RANGE.matcher(s);
        if (m.matches() && !s.contains("\"")) {
            String from = rewrite(m.group(1));
            String to = rewrite(m.group(3));
            boolean inclusive = m.group(2).equals("..");
            String count = from.equals("0")
                    ? (inclusive ? to + " + 1" : to)
                    : (inclusive ? to + " - " + from + " + 1" : to + " - " + from);
            String element = from.equals("0") ? "i" : from + " + i";
            return "List.generate(" + count + ", (i) => " + element + ")";
        }
        return rewrite(s);
    }

    /** Target string literal for a source string's content. */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("'");
        String v = value == null ? "" : value;
        for (int i = 0; i < v.length(); i++) {
            char c = v.charAt(i);
            if (c == '\\' && i + 1 < v.length()) {
                char next = v.charAt(i + 1);
                if (next == '"') {
                    sb.append('"');
                } else {
                    sb.append(c).append(next);
                }
                i++;
            } else if (c == '\'') {
                sb.append("\\'");
            } else {
                sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    /** {@code ArrowBack} -> {@code arrow_back}. */
    public static String snakeCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && (Character.isLowerCase(name.charAt(i - 1)) || Character.isDigit(name.charAt(i - 1)))) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String lowerFirst(String s) {
        if (s == null || s.isEmpty()) return s;
        return Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }

    public static boolean isIdentifier(String s) {
        return s != null && IDENTIFIER.matcher(s).matches();
    }

    // Replaces double-quoted literals by \0<index>\0 placeholders, collecting requoted literals.
    private String extractStrings(String source, List<String> strings) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"') {
                int end = i + 1;
                while (end < source.length() && source.charAt(end) != '"') {
                    if (source.charAt(end) == '\\') end++;
                    end++;
                }
                String content = source.substring(i + 1, Math.min(end, source.length()));
                strings.add(quote(rewriteTemplate(content)));
                out.append('\u0000').append(strings.size() - 1).append('\u0000');
                i = end + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private String rewriteTemplate(String content) {
        String out = content;
        for (String s : stateNames) {
            out = out.replaceAll("\\$\\{" + Pattern.quote(s) + "\\.value\\}", Matcher.quoteReplacement("$" + s));
            out = out.replaceAll("\\b" + Pattern.quote(s) + "\\.value\\b", Matcher.quoteReplacement(s));
        }
        for (String f : widgetFields) {
            if (stateNames.contains(f)) continue;
            out = out.replaceAll("\\$\\{" + Pattern.quote(f) + "\\b", Matcher.quoteReplacement("${widget." + f));
            out = out.replaceAll("\\$" + Pattern.quote(f) + "\\b", Matcher.quoteReplacement("${widget." + f + "}"));
        }
        return out;
    }

    private static String restoreStrings(String code, List<String> strings) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == '\u0000') {
                int end = code.indexOf('\u0000', i + 1);
                out.append(strings.get(Integer.parseInt(code.substring(i + 1, end))));
                i = end + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    // name(a, b) -> open a, b close, for balanced parentheses.
    static String replaceCall(String code, String name, String open, String close) {
        Pattern p = Pattern.compile("\\b" + Pattern.quote(name) + "(?:<[^>()]*>)?\\(");
        String out = code;
        Matcher m = p.matcher(out);
        while (m.find()) {
            int start = m.start();
            int argsStart = m.end();
            int depth = 1;
            int i = argsStart;
            while (i < out.length() && depth > 0) {
                char c = out.charAt(i);
                if (c == '(') depth++;
                else if (c == ')') depth--;
                i++;
            }
            if (depth != 0) break;
            String inner = out.substring(argsStart, i - 1);
            out = out.substring(0, start) + open + inner + close + out.substring(i);
            m = p.matcher(out);
        }
        return out;
    }

    // Inside call parentheses, `name = value` becomes `name: value`.
    static String namedArgumentsToColons(String code) {
        StringBuilder out = new StringBuilder();
        List<Character> stack = new ArrayList<>();
        int i = 0;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') stack.add(c);
            else if ((c == ')' || c == ']' || c == '}') && !stack.isEmpty()) stack.remove(stack.size() - 1);

            boolean inParens = !stack.isEmpty() && stack.get(stack.size() - 1) == '(';
            if (inParens && Character.isJavaIdentifierStart(c) && (i == 0 || !Character.isJavaIdentifierPart(code.charAt(i - 1)) && code.charAt(i - 1) != '.')) {
                int end = i;
                while (end < code.length() && Character.isJavaIdentifierPart(code.charAt(end))) end++;
                int j = end;
                while (j < code.length() && code.charAt(j) == ' ') j++;
                char prev = previousNonSpace(code, i);
                boolean argumentStart = prev == '(' || prev == ',';
                if (argumentStart && j < code.length() && code.charAt(j) == '='
                        && (j + 1 >= code.length() || code.charAt(j + 1) != '=')) {
                    out.append(code, i, end).append(": ");
                    i = j + 1;
                    while (i < code.length() && code.charAt(i) == ' ') i++;
                    continue;
                }
                out.append(code, i, end);
                i = end;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static char previousNonSpace(String code, int index) {
        for (int k = index - 1; k >= 0; k--) {
            char c = code.charAt(k);
            if (c != ' ' && c != '\n' && c != '\t') return c;
        }
        return 0;
    }

    private interface Replacer {
        String apply(Matcher m);
    }

    private static String replaceEach(String input, Pattern p, Replacer r) {
        Matcher m = p.matcher(input);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            sb.append(input, last, m.start()).append(r.apply(m));
            last = m.end();
        }
        sb.append(input.substring(last));
        return sb.toString();
    }
}
