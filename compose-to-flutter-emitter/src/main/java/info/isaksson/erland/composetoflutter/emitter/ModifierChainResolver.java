package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.dart.DartExpr;
import info.isaksson.erland.composetoflutter.ir.ModifierDirective;
import info.isaksson.erland.composetoflutter.ir.TypeDescriptor;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns modifier directives into nested wrapper widgets.
 *
 * <p>Directives apply in extraction order, each wrapping the result so far: the first
 * directive is the innermost wrapper and the last is the outermost. Unknown directives are
 * dropped with a {@link GenerationWarnings#UNKNOWN_MODIFIER} warning.</p>
 */
final class ModifierChainResolver {

    private final GenerationContext ctx;
    private final ArgumentRenderer arguments;

    ModifierChainResolver(GenerationContext ctx, ArgumentRenderer arguments) {
        this.ctx = ctx;
        this.arguments = arguments;
    }

    DartExpr apply(DartExpr child, List<ModifierDirective> directives) {
        DartExpr current = child;
        for (ModifierDirective d : directives) {
            DartExpr wrapped = wrap(d, current);
            if (wrapped == null) {
                ctx.warn(GenerationWarnings.UNKNOWN_MODIFIER, "Modifier dropped: " + d.name, d.name);
                continue;
            }
            current = wrapped;
        }
        return current;
    }

    // Null for unknown directives.
    private DartExpr wrap(ModifierDirective d, DartExpr child) {
        ExpressionRewriter rw = arguments.rewriter();
        switch (d.name) {
            case "padding":
                return wrapper("Padding").named("padding", insets(d.arguments, rw)).named("child", child).build();
            case "fillMaxWidth":
            case "fillMaxHeight":
            case "fillMaxSize":
                return fill(d, child, rw);
            case "width":
                return sized(text(d, "width", 0, rw), null, child);
            case "height":
                return sized(null, text(d, "height", 0, rw), child);
            case "size": {
                String w = d.argument("width", 0);
                String h = d.arguments.containsKey("height") ? d.arguments.get("height") : d.positional(1);
                String width = w == null ? null : rw.rewrite(w);
                String height = h == null ? width : rw.rewrite(h);
                return sized(width, height, child);
            }
            case "background":
                return background(d, child, rw);
            case "border":
                return border(d, child, rw);
            case "clip":
                return clip(d.argument("shape", 0), child);
            case "clipToBounds":
                return wrapper("ClipRect").named("child", child).build();
            case "clickable": {
                String handler = d.argument("onClick", 0);
                for (Map.Entry<String, String> e : d.arguments.entrySet()) {
                    if (e.getValue().trim().startsWith("{")) handler = e.getValue();
                }
                return wrapper("GestureDetector")
                        .named("onTap", arguments.callbackFromSource(handler, 0))
                        .named("child", child)
                        .build();
            }
            case "alpha":
                return wrapper("Opacity").named("opacity", text(d, "alpha", 0, rw)).named("child", child).build();
            case "weight":
                return wrapper("Expanded").named("flex", flex(d.argument("weight", 0))).named("child", child).build();
            case "align":
                return wrapper("Align").named("alignment", alignment(text(d, "alignment", 0, rw))).named("child", child).build();
            case "offset": {
                String x = d.argument("x", 0);
                String y = d.argument("y", 1);
                String offset = "Offset(" + (x == null ? "0" : rw.rewrite(x)) + ", " + (y == null ? "0" : rw.rewrite(y)) + ")";
                return wrapper("Transform.translate").named("offset", offset).named("child", child).build();
            }
            case "rotate":
                ctx.requireImport(GenerationContext.MATH_IMPORT);
                return wrapper("Transform.rotate")
                        .named("angle", text(d, "degrees", 0, rw) + " * pi / 180")
                        .named("child", child)
                        .build();
            case "scale":
                return wrapper("Transform.scale").named("scale", text(d, "scale", 0, rw)).named("child", child).build();
            case "verticalScroll":
                return wrapper("SingleChildScrollView").named("child", child).build();
            case "horizontalScroll":
                return wrapper("SingleChildScrollView")
                        .named("scrollDirection", "Axis.horizontal")
                        .named("child", child)
                        .build();
            case "shadow": {
                DartExpr.Call.Builder b = wrapper("Material").named("elevation", text(d, "elevation", 0, rw));
                String shape = d.argument("shape", 1);
                if (shape != null) b.named("borderRadius", arguments.borderRadius(shape));
                return b.named("child", child).build();
            }
            default:
                return null;
        }
    }

    /** {@code EdgeInsets} for padding arguments: all, symmetric or only. */
    static String insets(Map<String, String> args, ExpressionRewriter rw) {
        if (args.isEmpty()) return "EdgeInsets.zero";
        String all = args.containsKey("all") ? args.get("all") : args.get("0");
        if (all != null && args.size() == 1) {
            return constant("EdgeInsets.all(" + rw.rewrite(all) + ")");
        }
        String horizontal = args.get("horizontal");
        String vertical = args.get("vertical");
        if (horizontal != null || vertical != null) {
            List<String> parts = new ArrayList<>();
            if (horizontal != null) parts.add("horizontal: " + rw.rewrite(horizontal));
            if (vertical != null) parts.add("vertical: " + rw.rewrite(vertical));
            return constant("EdgeInsets.symmetric(" + String.join(", ", parts) + ")");
        }
        List<String> parts = new ArrayList<>();
        side(args, "start", "left", parts, rw);
        side(args, "top", "top", parts, rw);
        side(args, "end", "right", parts, rw);
        side(args, "bottom", "bottom", parts, rw);
        if (parts.isEmpty()) return "EdgeInsets.zero";
        return constant("EdgeInsets.only(" + String.join(", ", parts) + ")");
    }

    private static void side(Map<String, String> args, String source, String target, List<String> parts, ExpressionRewriter rw) {
        String v = args.get(source);
        if (v == null && source.equals("start")) v = args.get("left");
        if (v == null && source.equals("end")) v = args.get("right");
        if (v != null) parts.add(target + ": " + rw.rewrite(v));
    }

    // const only when every argument is a number literal.
    private static String constant(String insets) {
        String inner = insets.substring(insets.indexOf('(') + 1, insets.length() - 1);
        for (String part : inner.split(",")) {
            String value = part.contains(":") ? part.substring(part.indexOf(':') + 1).trim() : part.trim();
            if (!value.matches("-?\\d+(\\.\\d+)?")) return insets;
        }
        return "const " + insets;
    }

    private DartExpr fill(ModifierDirective d, DartExpr child, ExpressionRewriter rw) {
        String fraction = d.argument("fraction", 0);
        boolean width = !d.name.equals("fillMaxHeight");
        boolean height = !d.name.equals("fillMaxWidth");
        if (fraction != null) {
            String f = rw.rewrite(fraction);
            DartExpr.Call.Builder b = wrapper("FractionallySizedBox");
            if (width) b.named("widthFactor", f);
            if (height) b.named("heightFactor", f);
            return b.named("child", child).build();
        }
        if (width && height) return wrapper("SizedBox.expand").named("child", child).build();
        return sized(width ? "double.infinity" : null, height ? "double.infinity" : null, child);
    }

    private static DartExpr sized(String width, String height, DartExpr child) {
        DartExpr.Call.Builder b = wrapper("SizedBox");
        if (width != null) b.named("width", width);
        if (height != null) b.named("height", height);
        return b.named("child", child).build();
    }

    private DartExpr background(ModifierDirective d, DartExpr child, ExpressionRewriter rw) {
        String color = text(d, "color", 0, rw);
        String shape = d.argument("shape", 1);
        if (shape == null) {
            return wrapper("ColoredBox").named("color", color).named("child", child).build();
        }
        String decoration = "CircleShape".equals(shape.trim())
                ? "BoxDecoration(color: " + color + ", shape: BoxShape.circle)"
                : "BoxDecoration(color: " + color + ", borderRadius: " + arguments.borderRadius(shape) + ")";
        return wrapper("DecoratedBox").named("decoration", decoration).named("child", child).build();
    }

    private DartExpr border(ModifierDirective d, DartExpr child, ExpressionRewriter rw) {
        String width = d.argument("width", 0);
        String color = d.argument("color", 1);
        String shape = d.argument("shape", 2);
        String first = d.positional(0);
        if (first != null && first.trim().startsWith("BorderStroke(")) {
            String inner = first.trim();
            List<String> stroke = TypeDescriptor.splitTopLevel(inner.substring("BorderStroke(".length(), inner.length() - 1));
            Map<String, String> strokeArgs = ArgumentRenderer.argumentMap(stroke);
            width = strokeArgs.containsKey("width") ? strokeArgs.get("width") : strokeArgs.get("0");
            color = strokeArgs.containsKey("color") ? strokeArgs.get("color") : strokeArgs.get("1");
            shape = d.argument("shape", 1);
        }
        List<String> parts = new ArrayList<>();
        if (width != null) parts.add("width: " + rw.rewrite(width));
        if (color != null) parts.add("color: " + rw.rewrite(color));
        String decoration = "BoxDecoration(border: Border.all(" + String.join(", ", parts) + ")"
                + (shape == null ? "" : ", borderRadius: " + arguments.borderRadius(shape)) + ")";
        return wrapper("DecoratedBox").named("decoration", decoration).named("child", child).build();
    }

    private DartExpr clip(String shape, DartExpr child) {
        if (shape != null && "CircleShape".equals(shape.trim())) {
            return wrapper("ClipOval").named("child", child).build();
        }
        return wrapper("ClipRRect")
                .named("borderRadius", arguments.borderRadius(shape))
                .named("child", child)
                .build();
    }

    static String flex(String weight) {
        if (weight == null) return "1";
        String w = ArgumentRenderer.number(weight);
        try {
            return Long.toString(Math.max(1, Math.round(Double.parseDouble(w))));
        } catch (NumberFormatException e) {
            return "1";
        }
    }

    private static String alignment(String rewritten) {
        return rewritten.isEmpty() ? "Alignment.center" : rewritten;
    }

    private static String text(ModifierDirective d, String name, int position, ExpressionRewriter rw) {
        String v = d.argument(name, position);
        return v == null ? "" : rw.rewrite(v);
    }

    private static DartExpr.Call.Builder wrapper(String name) {
        return DartExpr.Call.builder(name);
    }
}
