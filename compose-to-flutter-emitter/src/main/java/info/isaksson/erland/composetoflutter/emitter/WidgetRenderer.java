package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.dart.DartExpr;
import info.isaksson.erland.composetoflutter.ir.ArgumentValue;
import info.isaksson.erland.composetoflutter.ir.ModifierDirective;
import info.isaksson.erland.composetoflutter.ir.UiNode;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;
import info.isaksson.erland.composetoflutter.mapping.WidgetMappings;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Widget rule table. Each known source widget has a rule that synthesizes the target
 * constructor and its arguments; everything else goes through the generic rule.
 */
final class WidgetRenderer {

    private static final Pattern CONSTANT_CODE = Pattern.compile(
            "^(?:-?\\d+(?:\\.\\d+)?|true|false|null|'[^'$\\\\]*'|double\\.infinity|const .*"
                    + "|(?:Icons|Colors|Alignment|MainAxisAlignment|CrossAxisAlignment|MainAxisSize|FontWeight|FontStyle"
                    + "|TextAlign|TextOverflow|BoxFit|Axis)\\.[A-Za-z0-9_]+)$");
    private static final Pattern SPACED_BY = Pattern.compile("^Arrangement\\.spacedBy\\((.+)\\)$");
    private static final Pattern DRAWABLE = Pattern.compile("\\bR\\.drawable\\.([A-Za-z0-9_]+)");
    private static final Pattern ASYNC_PAINTER = Pattern.compile("^rememberAsyncImagePainter\\((?:model\\s*=\\s*)?(.+?)\\)$", Pattern.DOTALL);
    private static final Pattern DEFAULT_ELEVATION = Pattern.compile("defaultElevation\\s*=\\s*([^,)]+)");
    private static final Pattern GRID_CELLS = Pattern.compile("^GridCells\\.(Fixed|Adaptive)\\((.+)\\)$");
    private static final Pattern TEXT_OVERFLOW = Pattern.compile("\\bTextOverflow\\.([A-Z][A-Za-z]*)");
    private static final Pattern RANGE = Pattern.compile("^(.+?)\\s*\\.\\.\\s*(.+)$");

    private final NodeRenderer nodes;
    private final ArgumentRenderer args;
    private final ModifierChainResolver modifiers;
    private final GenerationContext ctx;

    WidgetRenderer(NodeRenderer nodes, ArgumentRenderer args, ModifierChainResolver modifiers, GenerationContext ctx) {
        this.nodes = nodes;
        this.args = args;
        this.modifiers = modifiers;
        this.ctx = ctx;
    }

    DartExpr render(UiNode.Widget w) {
        if (w.name.equals("Spacer") && !ctx.widgets.isOverridden(w.name)) {
            return spacer(w);
        }
        return modifiers.apply(construct(w), w.modifiers);
    }

    private DartExpr construct(UiNode.Widget w) {
        if (ctx.widgets.isOverridden(w.name)) return generic(w);
        switch (w.name) {
            case "Text":
                return text(w);
            case "Button":
            case "ElevatedButton":
            case "FilledButton":
            case "TextButton":
            case "OutlinedButton":
                return button(w);
            case "IconButton":
                return iconButton(w);
            case "FloatingActionButton":
                return fab(w);
            case "ExtendedFloatingActionButton":
                return extendedFab(w);
            case "TextField":
            case "OutlinedTextField":
            case "BasicTextField":
                return textField(w);
            case "Checkbox":
            case "Switch":
                return toggle(w);
            case "Slider":
                return slider(w);
            case "Image":
            case "AsyncImage":
                return image(w);
            case "Icon":
                return icon(w);
            case "Column":
            case "Row":
                return flex(w);
            case "Box":
                return box(w);
            case "LazyColumn":
            case "LazyRow":
                return lazyList(w);
            case "LazyVerticalGrid":
                return grid(w);
            case "Card":
            case "ElevatedCard":
            case "OutlinedCard":
                return card(w);
            case "Surface":
                return surface(w);
            case "Scaffold":
                return scaffold(w);
            case "TopAppBar":
            case "CenterAlignedTopAppBar":
            case "SmallTopAppBar":
            case "MediumTopAppBar":
            case "LargeTopAppBar":
                return appBar(w);
            case "Divider":
            case "HorizontalDivider":
            case "VerticalDivider":
                return divider(w);
            case "CircularProgressIndicator":
            case "LinearProgressIndicator":
                return progress(w);
            case "AlertDialog":
                return dialog(w);
            default:
                return generic(w);
        }
    }

    private DartExpr text(UiNode.Widget w) {
        ArgumentValue value = arg(w, "text", 0);
        DartExpr.Call.Builder b = DartExpr.Call.builder("Text")
                .positional(value == null ? new DartExpr.Code("''") : args.value(value));

        List<String> style = new ArrayList<>();
        addStyle(style, w, "fontSize");
        addStyle(style, w, "fontWeight");
        addStyle(style, w, "fontStyle");
        addStyle(style, w, "color");
        addStyle(style, w, "letterSpacing");
        ArgumentValue base = w.argument("style");
        if (base != null) {
            String themed = args.code(base);
            if (style.isEmpty()) {
                b.named("style", themed);
            } else {
                String access = themed.startsWith("Theme.of(context).textTheme") ? "?.copyWith(" : ".copyWith(";
                b.named("style", themed + access + String.join(", ", style) + ")");
            }
        } else if (!style.isEmpty()) {
            b.named("style", constant("TextStyle(" + String.join(", ", style) + ")", style));
        }
        named(b, w, "textAlign", "textAlign");
        named(b, w, "maxLines", "maxLines");
        ArgumentValue overflow = w.argument("overflow");
        if (overflow != null) {
            Matcher m = TEXT_OVERFLOW.matcher(overflow.text());
            b.named("overflow", m.find() ? "TextOverflow." + ExpressionRewriter.lowerFirst(m.group(1)) : args.code(overflow));
        }
        return constantIfPossible(b.build());
    }

    private void addStyle(List<String> style, UiNode.Widget w, String name) {
        ArgumentValue v = w.argument(name);
        if (v == null) return;
        String code = args.code(v);
        if (name.equals("fontStyle")) {
            code = code.replace("FontStyle.Italic", "FontStyle.italic").replace("FontStyle.Normal", "FontStyle.normal");
        }
        style.add(name + ": " + code);
    }

    private DartExpr button(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder(ctx.widgets.widgetName(w.name))
                .named("onPressed", enabled(w, args.callback(w.argument("onClick"), 0)));
        DartExpr child;
        if (!w.children.isEmpty()) {
            child = w.children.size() == 1
                    ? nodes.render(w.children.get(0))
                    : DartExpr.Call.builder("Row")
                    .named("mainAxisSize", "MainAxisSize.min")
                    .named("children", nodes.children(w.children))
                    .build();
        } else {
            ArgumentValue label = arg(w, "text", 0);
            child = label == null
                    ? NodeRenderer.EMPTY
                    : constantIfPossible(DartExpr.Call.builder("Text").positional(args.value(label)).build());
        }
        return b.named("child", child).build();
    }

    private DartExpr iconButton(UiNode.Widget w) {
        DartExpr icon = w.children.isEmpty()
                ? DartExpr.Call.builder("Icon").positional(new DartExpr.Code("Icons.help_outline")).constant(true).build()
                : nodes.group(w.children);
        return DartExpr.Call.builder("IconButton")
                .named("onPressed", enabled(w, args.callback(w.argument("onClick"), 0)))
                .named("icon", icon)
                .build();
    }

    private DartExpr fab(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("FloatingActionButton")
                .named("onPressed", args.callback(w.argument("onClick"), 0));
        named(b, w, "containerColor", "backgroundColor");
        if (!w.children.isEmpty()) b.named("child", nodes.group(w.children));
        return b.build();
    }

    private DartExpr extendedFab(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("FloatingActionButton.extended")
                .named("onPressed", args.callback(w.argument("onClick"), 0));
        DartExpr icon = args.slot(w.argument("icon"));
        if (icon != null) b.named("icon", icon);
        DartExpr label = args.slot(w.argument("text"));
        if (label == null && !w.children.isEmpty()) label = nodes.group(w.children);
        b.named("label", label == null ? NodeRenderer.EMPTY : label);
        return b.build();
    }

    private DartExpr textField(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("TextField");
        ArgumentValue value = arg(w, "value", 0);
        if (value != null) {
            b.named("controller", "TextEditingController(text: " + args.code(value) + ")");
        }
        b.named("onChanged", args.callback(w.argument("onValueChange"), 1));

        DartExpr.Call.Builder decoration = DartExpr.Call.builder("InputDecoration");
        slotText(decoration, w.argument("label"), "labelText", "label");
        slotText(decoration, w.argument("placeholder"), "hintText", "hint");
        DartExpr leading = args.slot(w.argument("leadingIcon"));
        if (leading != null) decoration.named("prefixIcon", leading);
        DartExpr trailing = args.slot(w.argument("trailingIcon"));
        if (trailing != null) decoration.named("suffixIcon", trailing);
        if (w.name.equals("OutlinedTextField")) {
            decoration.named("border", DartExpr.Call.builder("OutlineInputBorder").constant(true).build());
        }
        DartExpr.Call built = decoration.build();
        if (built.hasArguments()) b.named("decoration", built);

        ArgumentValue singleLine = w.argument("singleLine");
        if (singleLine instanceof ArgumentValue.BoolValue bool && bool.value) b.named("maxLines", "1");
        ArgumentValue transformation = w.argument("visualTransformation");
        if (transformation != null && transformation.text().contains("PasswordVisualTransformation")) {
            b.named("obscureText", "true");
        }
        named(b, w, "enabled", "enabled");
        named(b, w, "readOnly", "readOnly");
        named(b, w, "maxLines", "maxLines");
        return b.build();
    }

    // label = { Text("Name") } becomes labelText: 'Name'; other slots keep their widget.
    private void slotText(DartExpr.Call.Builder b, ArgumentValue slot, String textName, String widgetName) {
        if (slot == null) return;
        if (slot instanceof ArgumentValue.Closure c && c.nodes.size() == 1
                && c.nodes.get(0) instanceof UiNode.Widget t && t.name.equals("Text")
                && t.modifiers.isEmpty() && t.arguments.size() == 1 && arg(t, "text", 0) != null) {
            b.named(textName, args.value(arg(t, "text", 0)));
            return;
        }
        if (slot instanceof ArgumentValue.StringValue) {
            b.named(textName, args.value(slot));
            return;
        }
        DartExpr content = args.slot(slot);
        if (content != null) b.named(widgetName, content);
    }

    private DartExpr toggle(UiNode.Widget w) {
        ArgumentValue checked = arg(w, "checked", 0);
        return DartExpr.Call.builder(w.name)
                .named("value", checked == null ? "false" : args.code(checked))
                .named("onChanged", enabled(w, args.callback(w.argument("onCheckedChange"), 1)))
                .build();
    }

    private DartExpr slider(UiNode.Widget w) {
        ArgumentValue value = arg(w, "value", 0);
        DartExpr.Call.Builder b = DartExpr.Call.builder("Slider")
                .named("value", value == null ? "0.0" : args.code(value))
                .named("onChanged", args.callback(w.argument("onValueChange"), 1));
        ArgumentValue range = w.argument("valueRange");
        if (range != null) {
            Matcher m = RANGE.matcher(range.text().trim());
            if (m.matches()) {
                b.named("min", args.rewriter().rewrite(m.group(1)));
                b.named("max", args.rewriter().rewrite(m.group(2)));
            }
        }
        ArgumentValue steps = w.argument("steps");
        if (steps instanceof ArgumentValue.IntValue n) b.named("divisions", Long.toString(n.value + 1));
        return b.build();
    }

    private DartExpr image(UiNode.Widget w) {
        ArgumentValue source = w.name.equals("AsyncImage") ? arg(w, "model", 0) : arg(w, "painter", 0);
        ArgumentValue vector = w.argument("imageVector");
        if (source == null && vector != null) {
            return DartExpr.Call.builder("Icon").positional(args.value(vector)).build();
        }
        String text = source == null ? "" : source.text().trim();
        ArgumentValue description = w.argument("contentDescription");
        ArgumentValue scale = w.argument("contentScale");

        Matcher async = ASYNC_PAINTER.matcher(text);
        if (w.name.equals("AsyncImage") || async.matches()) {
            ctx.requireImport(GenerationContext.NETWORK_IMAGE_IMPORT);
            String url = w.name.equals("AsyncImage") ? args.code(source) : args.rewriter().rewrite(async.group(1));
            DartExpr.Call.Builder b = DartExpr.Call.builder("CachedNetworkImage").named("imageUrl", url);
            if (scale != null) b.named("fit", args.code(scale));
            return b.build();
        }
        Matcher drawable = DRAWABLE.matcher(text);
        DartExpr.Call.Builder b;
        if (drawable.find()) {
            b = DartExpr.Call.builder("Image.asset").positional(new DartExpr.Code(asset(drawable.group(1))));
        } else if (source != null) {
            b = DartExpr.Call.builder("Image").named("image", args.code(source));
        } else {
            return DartExpr.Call.builder("Placeholder").constant(true).build();
        }
        if (scale != null) b.named("fit", args.code(scale));
        if (description != null && !(description instanceof ArgumentValue.NullValue)) {
            b.named("semanticLabel", args.code(description));
        }
        return b.build();
    }

    private DartExpr icon(UiNode.Widget w) {
        ArgumentValue source = w.argument("imageVector");
        if (source == null) source = w.argument("painter");
        if (source == null) source = w.argument("arg0");
        String text = source == null ? "" : source.text().trim();
        Matcher drawable = DRAWABLE.matcher(text);
        DartExpr.Call.Builder b;
        if (drawable.find()) {
            b = DartExpr.Call.builder("ImageIcon").positional(new DartExpr.Code("AssetImage(" + asset(drawable.group(1)) + ")"));
        } else {
            b = DartExpr.Call.builder("Icon").positional(new DartExpr.Code(source == null ? "Icons.help_outline" : args.code(source)));
        }
        ArgumentValue description = w.argument("contentDescription");
        if (description != null && !(description instanceof ArgumentValue.NullValue)) {
            b.named("semanticLabel", args.code(description));
        }
        named(b, w, "tint", "color");
        return constantIfPossible(b.build());
    }

    private static String asset(String name) {
        return "'assets/images/" + name + ".png'";
    }

    private DartExpr flex(UiNode.Widget w) {
        boolean column = w.name.equals("Column");
        DartExpr.Call.Builder b = DartExpr.Call.builder(w.name);
        ArgumentValue arrangement = w.argument(column ? "verticalArrangement" : "horizontalArrangement");
        if (arrangement != null) {
            Matcher spaced = SPACED_BY.matcher(arrangement.text().trim());
            if (spaced.matches()) {
                b.named("spacing", args.rewriter().rewrite(spaced.group(1)));
            } else {
                b.named("mainAxisAlignment", args.code(arrangement));
            }
        }
        ArgumentValue alignment = w.argument(column ? "horizontalAlignment" : "verticalAlignment");
        if (alignment != null) b.named("crossAxisAlignment", crossAxis(alignment.text()));
        return b.named("children", nodes.children(w.children)).build();
    }

    private static String crossAxis(String source) {
        String s = source.trim();
        String name = s.substring(s.lastIndexOf('.') + 1);
        switch (name) {
            case "Start":
            case "Top":
                return "CrossAxisAlignment.start";
            case "End":
            case "Bottom":
                return "CrossAxisAlignment.end";
            default:
                return "CrossAxisAlignment.center";
        }
    }

    private DartExpr box(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("Stack");
        named(b, w, "contentAlignment", "alignment");
        return b.named("children", nodes.children(w.children)).build();
    }

    private DartExpr lazyList(UiNode.Widget w) {
        boolean horizontal = w.name.equals("LazyRow");
        DartExpr.Call.Builder b;
        if (w.children.size() == 1 && w.children.get(0) instanceof UiNode.Iteration it) {
            String source = args.rewriter().iterationSource(it.source);
            b = DartExpr.Call.builder("ListView.builder");
            if (horizontal) b.named("scrollDirection", "Axis.horizontal");
            named(b, w, "contentPadding", "padding");
            b.named("itemCount", source + ".length");
            b.named("itemBuilder", new DartExpr.Callback(
                    List.of("context", "index"),
                    List.of("final " + it.variable + " = " + source + "[index]"),
                    nodes.group(it.children)));
            return b.build();
        }
        b = DartExpr.Call.builder("ListView");
        if (horizontal) b.named("scrollDirection", "Axis.horizontal");
        named(b, w, "contentPadding", "padding");
        return b.named("children", nodes.children(w.children)).build();
    }

    private DartExpr grid(UiNode.Widget w) {
        ArgumentValue columns = w.argument("columns");
        Matcher m = GRID_CELLS.matcher(columns == null ? "" : columns.text().trim());
        DartExpr.Call.Builder b;
        if (m.matches() && m.group(1).equals("Adaptive")) {
            b = DartExpr.Call.builder("GridView.extent").named("maxCrossAxisExtent", args.rewriter().rewrite(m.group(2)));
        } else {
            b = DartExpr.Call.builder("GridView.count")
                    .named("crossAxisCount", m.matches() ? args.rewriter().rewrite(m.group(2)) : "2");
        }
        named(b, w, "contentPadding", "padding");
        return b.named("children", nodes.children(w.children)).build();
    }

    private DartExpr card(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("Card");
        ArgumentValue elevation = w.argument("elevation");
        if (elevation != null) {
            Matcher m = DEFAULT_ELEVATION.matcher(elevation.text());
            b.named("elevation", m.find() ? args.rewriter().rewrite(m.group(1).trim()) : args.code(elevation));
        }
        named(b, w, "shape", "shape");
        return b.named("child", tappable(w, nodes.group(w.children))).build();
    }

    private DartExpr surface(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("Material");
        named(b, w, "color", "color");
        ArgumentValue elevation = w.argument("shadowElevation");
        if (elevation == null) elevation = w.argument("tonalElevation");
        if (elevation != null) b.named("elevation", args.code(elevation));
        named(b, w, "shape", "shape");
        return b.named("child", tappable(w, nodes.group(w.children))).build();
    }

    private DartExpr tappable(UiNode.Widget w, DartExpr child) {
        ArgumentValue onClick = w.argument("onClick");
        if (onClick == null) return child;
        return DartExpr.Call.builder("InkWell")
                .named("onTap", args.callback(onClick, 0))
                .named("child", child)
                .build();
    }

    private DartExpr scaffold(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("Scaffold");
        slot(b, w, "topBar", "appBar");
        if (!w.children.isEmpty()) b.named("body", nodes.group(w.children));
        slot(b, w, "floatingActionButton", "floatingActionButton");
        slot(b, w, "bottomBar", "bottomNavigationBar");
        named(b, w, "containerColor", "backgroundColor");
        return b.build();
    }

    private DartExpr appBar(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("AppBar");
        slot(b, w, "title", "title");
        slot(b, w, "navigationIcon", "leading");
        ArgumentValue actions = w.argument("actions");
        if (actions instanceof ArgumentValue.Closure c && !c.nodes.isEmpty()) {
            b.named("actions", nodes.children(c.nodes));
        }
        if (w.name.equals("CenterAlignedTopAppBar")) b.named("centerTitle", "true");
        return b.build();
    }

    private DartExpr divider(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder(w.name.equals("VerticalDivider") ? "VerticalDivider" : "Divider");
        named(b, w, "thickness", "thickness");
        named(b, w, "color", "color");
        return constantIfPossible(b.build());
    }

    private DartExpr progress(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder(w.name);
        ArgumentValue progress = arg(w, "progress", 0);
        if (progress instanceof ArgumentValue.Closure c && c.statements.size() == 1) {
            b.named("value", args.rewriter().rewrite(c.statements.get(0)));
        } else if (progress != null) {
            b.named("value", args.code(progress));
        }
        named(b, w, "color", "color");
        return constantIfPossible(b.build());
    }

    private DartExpr dialog(UiNode.Widget w) {
        DartExpr.Call.Builder b = DartExpr.Call.builder("AlertDialog");
        slot(b, w, "title", "title");
        slot(b, w, "text", "content");
        List<DartExpr> actions = new ArrayList<>();
        DartExpr dismiss = args.slot(w.argument("dismissButton"));
        if (dismiss != null) actions.add(dismiss);
        DartExpr confirm = args.slot(w.argument("confirmButton"));
        if (confirm != null) actions.add(confirm);
        if (!actions.isEmpty()) b.named("actions", new DartExpr.ListLiteral(actions, false));
        return b.build();
    }

    private DartExpr spacer(UiNode.Widget w) {
        String width = null;
        String height = null;
        String flex = null;
        List<ModifierDirective> rest = new ArrayList<>();
        ExpressionRewriter rw = args.rewriter();
        for (ModifierDirective d : w.modifiers) {
            if (d.name.equals("height") && d.argument("height", 0) != null) {
                height = rw.rewrite(d.argument("height", 0));
            } else if (d.name.equals("width") && d.argument("width", 0) != null) {
                width = rw.rewrite(d.argument("width", 0));
            } else if (d.name.equals("size") && d.argument("size", 0) != null) {
                width = rw.rewrite(d.argument("size", 0));
                height = width;
            } else if (d.name.equals("weight")) {
                flex = ModifierChainResolver.flex(d.argument("weight", 0));
            } else {
                rest.add(d);
            }
        }
        DartExpr core;
        if (width != null || height != null) {
            DartExpr.Call.Builder b = DartExpr.Call.builder("SizedBox");
            if (width != null) b.named("width", width);
            if (height != null) b.named("height", height);
            core = constantIfPossible(b.build());
        } else if (flex != null && !flex.equals("1")) {
            core = constantIfPossible(DartExpr.Call.builder("Spacer").named("flex", flex).build());
        } else {
            core = constantIfPossible(DartExpr.Call.builder("Spacer").build());
        }
        return modifiers.apply(core, rest);
    }

    /**
     * Fallback rule: mapped name and argument names, {@code child:} for one child and
     * {@code children:} for several. Project components keep their own argument names, take
     * positional arguments under their declared parameter names and receive their UI content
     * as {@code content:}.
     */
    DartExpr generic(UiNode.Widget w) {
        boolean project = ctx.isProjectSymbol(w.name);
        if (!project && !ctx.widgets.isKnown(w.name)) {
            ctx.warn(GenerationWarnings.UNKNOWN_WIDGET, "Widget rendered as-is: " + w.name, w.name);
        }
        DartExpr.Call.Builder b = DartExpr.Call.builder(project ? w.name : ctx.widgets.widgetName(w.name));
        for (Map.Entry<String, ArgumentValue> e : w.arguments.entrySet()) {
            String key = e.getKey();
            ArgumentValue v = e.getValue();
            String name;
            if (isPositionalKey(key)) {
                name = project ? positionalParameter(w.name, key) : null;
                if (name == null) {
                    b.positional(args.value(v));
                    continue;
                }
                // Components have no style parameter.
                if (ComponentScope.STYLE_PARAMETER.equals(name)) continue;
            } else {
                name = project ? key : WidgetMappings.argumentName(key);
            }
            if (v instanceof ArgumentValue.Closure c && c.nodes.isEmpty()) {
                b.named(name, args.callback(c, ArgumentRenderer.arity(isPositionalKey(key) ? name : key)));
            } else {
                b.named(name, args.value(v));
            }
        }
        if (!w.children.isEmpty()) {
            if (project) {
                b.named(CodeGenerator.CONTENT_PARAMETER, nodes.group(w.children));
            } else if (w.children.size() == 1 && !(w.children.get(0) instanceof UiNode.Iteration)) {
                b.named("child", nodes.render(w.children.get(0)));
            } else {
                b.named("children", nodes.children(w.children));
            }
        }
        return constantIfPossible(b.build());
    }

    /** Declared name of the positional argument {@code argN}, or null with a warning. */
    private String positionalParameter(String component, String key) {
        List<String> params = ctx.componentParameters(component);
        int index = Integer.parseInt(key.substring(3));
        if (params == null || index >= params.size()) {
            ctx.warn(GenerationWarnings.UNKNOWN_WIDGET,
                    "Positional argument " + index + " kept, parameter name unknown: " + component, component);
            return null;
        }
        return params.get(index);
    }

    private static boolean isPositionalKey(String key) {
        return key.startsWith("arg") && key.length() > 3 && key.substring(3).chars().allMatch(Character::isDigit);
    }

    private DartExpr enabled(UiNode.Widget w, DartExpr callback) {
        ArgumentValue enabled = w.argument("enabled");
        if (enabled == null) return callback;
        if (enabled instanceof ArgumentValue.BoolValue b) {
            return b.value ? callback : new DartExpr.Code("null");
        }
        return new DartExpr.Ternary(args.code(enabled), callback, new DartExpr.Code("null"));
    }

    private void named(DartExpr.Call.Builder b, UiNode.Widget w, String source, String target) {
        ArgumentValue v = w.argument(source);
        if (v != null) b.named(target, args.code(v));
    }

    private void slot(DartExpr.Call.Builder b, UiNode.Widget w, String source, String target) {
        DartExpr content = args.slot(w.argument(source));
        if (content != null) b.named(target, content);
    }

    private static ArgumentValue arg(UiNode.Widget w, String name, int position) {
        ArgumentValue v = w.argument(name);
        return v != null ? v : w.argument("arg" + position);
    }

    private String constant(String code, List<String> parts) {
        if (!ctx.options.constConstructors) return code;
        for (String p : parts) {
            String value = p.substring(p.indexOf(':') + 1).trim();
            if (!CONSTANT_CODE.matcher(value).matches()) return code;
        }
        return "const " + code;
    }

    /** Marks an argument-only call {@code const} when every argument is a compile-time constant. */
    DartExpr.Call constantIfPossible(DartExpr.Call call) {
        if (!ctx.options.constConstructors || call.constant) return call;
        for (DartExpr p : call.positional) {
            if (!isConstant(p)) return call;
        }
        for (DartExpr v : call.named.values()) {
            if (!isConstant(v)) return call;
        }
        DartExpr.Call.Builder b = DartExpr.Call.builder(call.callee).constant(true);
        for (DartExpr p : call.positional) b.positional(unconst(p));
        for (Map.Entry<String, DartExpr> e : call.named.entrySet()) b.named(e.getKey(), unconst(e.getValue()));
        return b.build();
    }

    private static boolean isConstant(DartExpr e) {
        if (e instanceof DartExpr.Code c) return CONSTANT_CODE.matcher(c.text).matches();
        if (e instanceof DartExpr.Call c) return c.constant;
        return false;
    }

    // Inside a const constructor nested constructors are implicitly const.
    private static DartExpr unconst(DartExpr e) {
        if (e instanceof DartExpr.Code c && c.text.startsWith("const ")) return new DartExpr.Code(c.text.substring(6));
        if (e instanceof DartExpr.Call c && c.constant) {
            DartExpr.Call.Builder b = DartExpr.Call.builder(c.callee);
            for (DartExpr p : c.positional) b.positional(p);
            for (Map.Entry<String, DartExpr> n : c.named.entrySet()) b.named(n.getKey(), n.getValue());
            return b.build();
        }
        return e;
    }
}
