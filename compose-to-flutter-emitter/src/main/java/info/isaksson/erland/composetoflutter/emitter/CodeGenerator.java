package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.dart.DartPrinter;
import info.isaksson.erland.composetoflutter.ir.SourceParameter;
import info.isaksson.erland.composetoflutter.ir.StateFlavor;
import info.isaksson.erland.composetoflutter.ir.StateVariable;
import info.isaksson.erland.composetoflutter.ir.UiTree;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders one UI tree as a widget class.
 *
 * <p>A tree with state variables becomes a stateful widget with a separate state class;
 * otherwise a stateless widget. Parameters other than the style parameter become final
 * fields set through named constructor parameters.</p>
 */
public final class CodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    /** Parameter that receives a project component's UI content. */
    public static final String CONTENT_PARAMETER = "content";

    private static final String BUILD_INDENT = "    ";

    private final DartPrinter printer = new DartPrinter();

    public GeneratedComponent generate(UiTree tree, GenerationContext ctx) {
        if (tree == null) throw new IllegalArgumentException("tree must not be null");
        if (ctx == null) throw new IllegalArgumentException("ctx must not be null");

        ComponentScope scope = new ComponentScope(tree);
        NodeRenderer renderer = new NodeRenderer(scope, ctx);
        ctx.requireImport(GenerationContext.MATERIAL_IMPORT);

        String body = printer.print(renderer.group(tree.roots), 2);
        List<String> fields = fields(tree, ctx);
        String code = scope.stateful
                ? stateful(tree, scope, fields, body, ctx)
                : stateless(tree, fields, body);
        ComponentShape shape = scope.stateful ? ComponentShape.STATEFUL : ComponentShape.STATELESS;
        LOG.debug("Generated {} component {} ({} state variable(s))", shape, tree.name, tree.state.size());
        return new GeneratedComponent(tree.name, shape, code);
    }

    private String stateless(UiTree tree, List<String> fields, String body) {
        StringBuilder sb = new StringBuilder();
        sb.append("class ").append(tree.name).append(" extends StatelessWidget {\n");
        appendFields(sb, fields);
        appendConstructor(sb, tree);
        sb.append('\n');
        appendBuild(sb, body);
        return sb.append("}\n").toString();
    }

    private String stateful(UiTree tree, ComponentScope scope, List<String> fields, String body, GenerationContext ctx) {
        String stateClass = "_" + tree.name + "State";
        StringBuilder sb = new StringBuilder();
        sb.append("class ").append(tree.name).append(" extends StatefulWidget {\n");
        appendFields(sb, fields);
        appendConstructor(sb, tree);
        sb.append('\n');
        sb.append("  @override\n");
        sb.append("  State<").append(tree.name).append("> createState() => ").append(stateClass).append("();\n");
        sb.append("}\n\n");

        sb.append("class ").append(stateClass).append(" extends State<").append(tree.name).append("> {\n");
        for (StateVariable v : tree.state) {
            sb.append("  ").append(stateField(v, scope.rewriter, ctx, tree.name)).append('\n');
        }
        sb.append('\n');
        appendBuild(sb, body);
        return sb.append("}\n").toString();
    }

    private List<String> fields(UiTree tree, GenerationContext ctx) {
        List<String> out = new ArrayList<>();
        for (SourceParameter p : parameters(tree)) {
            out.add("final " + parameterType(p, ctx, tree.name) + " " + p.name + ";");
        }
        return out;
    }

    private static List<SourceParameter> parameters(UiTree tree) {
        List<SourceParameter> out = new ArrayList<>();
        for (SourceParameter p : tree.parameters) {
            if (!ComponentScope.STYLE_PARAMETER.equals(p.name)) out.add(p);
        }
        return out;
    }

    private static void appendFields(StringBuilder sb, List<String> fields) {
        for (String f : fields) sb.append("  ").append(f).append('\n');
        if (!fields.isEmpty()) sb.append('\n');
    }

    private static void appendConstructor(StringBuilder sb, UiTree tree) {
        List<SourceParameter> params = parameters(tree);
        if (params.isEmpty()) {
            sb.append("  const ").append(tree.name).append("({super.key});\n");
            return;
        }
        sb.append("  const ").append(tree.name).append("({\n");
        sb.append("    super.key,\n");
        for (SourceParameter p : params) {
            sb.append("    ").append(constructorParameter(p)).append(",\n");
        }
        sb.append("  });\n");
    }

    private void appendBuild(StringBuilder sb, String body) {
        sb.append("  @override\n");
        sb.append("  Widget build(BuildContext context) {\n");
        sb.append(BUILD_INDENT).append("return ").append(body).append(";\n");
        sb.append("  }\n");
    }

    static String constructorParameter(SourceParameter p) {
        String dflt = defaultValue(p);
        if (dflt != null) return "this." + p.name + " = " + dflt;
        if (!p.nullable && !isFunctionDefault(p)) return "required this." + p.name;
        return "this." + p.name;
    }

    /** Target type of a parameter; composable slots become widgets. */
    static String parameterType(SourceParameter p, GenerationContext ctx, String owner) {
        String type = p.type == null ? "" : p.type.trim();
        if (type.contains("@Composable")) return p.nullable ? "Widget?" : "Widget";
        String mapped = ctx.mapType(type, owner);
        if (isFunctionDefault(p) && !mapped.endsWith("?")) {
            // Closures cannot be constant defaults; the field becomes optional instead.
            return mapped + "?";
        }
        return mapped;
    }

    /** Target default value, or null when the parameter has none or it is not constant. */
    static String defaultValue(SourceParameter p) {
        if (!p.hasDefault() || isFunctionDefault(p)) return null;
        String v = ExpressionRewriter.plain().rewrite(p.defaultValue);
        if (v.startsWith("[") || v.startsWith("{")) return "const " + v;
        return v;
    }

    private static boolean isFunctionDefault(SourceParameter p) {
        return p.hasDefault() && p.defaultValue.trim().startsWith("{") && p.type != null && p.type.contains("->");
    }

    private String stateField(StateVariable v, ExpressionRewriter rw, GenerationContext ctx, String owner) {
        String type = ctx.mapType(v.type, owner);
        if (v.flavor == StateFlavor.DERIVED) {
            String expr = derivedExpression(v.initializer);
            return (type.equals("dynamic") ? "" : type + " ") + "get " + v.name + " => " + rw.rewrite(expr) + ";";
        }
        String initial;
        if (v.flavor == StateFlavor.LIST_CELL) {
            initial = blank(v.initialValue) ? "[]" : "[" + rw.rewrite(v.initialValue) + "]";
        } else if (v.flavor == StateFlavor.MAP_CELL) {
            initial = blank(v.initialValue) ? "{}" : "{" + rw.rewrite(v.initialValue.replaceAll("\\s+to\\s+", ": ")) + "}";
        } else if (blank(v.initialValue)) {
            initial = defaultFor(type);
            if (initial.equals("null") && !type.endsWith("?") && !type.equals("dynamic")) type = type + "?";
        } else {
            initial = rw.rewrite(v.initialValue);
        }
        String declaration = (type.equals("dynamic") ? "var" : type) + " " + v.name + " = " + initial + ";";
        if (v.flavor == StateFlavor.STREAM_PROJECTED && ctx.options.sourceComments) {
            declaration += " // collected from " + v.initializer.trim();
        }
        return declaration;
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    // Contents of the derivedStateOf { ... } block.
    static String derivedExpression(String initializer) {
        String s = initializer == null ? "" : initializer;
        int marker = s.indexOf("derivedStateOf");
        int open = s.indexOf('{', marker < 0 ? 0 : marker);
        if (open < 0) return s.trim();
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '{') depth++;
            else if (c == '}' && --depth == 0) return s.substring(open + 1, i).trim();
        }
        return s.substring(open + 1).trim();
    }

    static String defaultFor(String type) {
        String t = type.endsWith("?") ? type.substring(0, type.length() - 1) : type;
        if (type.endsWith("?")) return "null";
        if (t.equals("bool")) return "false";
        if (t.equals("int") || t.equals("num")) return "0";
        if (t.equals("double")) return "0.0";
        if (t.equals("String")) return "''";
        if (t.startsWith("List")) return "[]";
        if (t.startsWith("Map")) return "{}";
        if (t.startsWith("Set")) return "{}";
        return "null";
    }
}
