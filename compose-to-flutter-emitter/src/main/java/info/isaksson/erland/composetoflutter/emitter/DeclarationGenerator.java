package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.ir.DeclarationKind;
import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import info.isaksson.erland.composetoflutter.ir.SourceParameter;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders declarations that are not components: data classes, sealed hierarchies, enums,
 * interfaces, objects, regular classes, functions and properties.
 *
 * <p>Function bodies are rewritten statement by statement; the result is a best-effort
 * starting point rather than a semantic translation.</p>
 */
public final class DeclarationGenerator {

    private static final Pattern LOCAL_DECLARATION = Pattern.compile("^(?:val|var)\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*([^=]+?)\\s*=");
    private static final Pattern ENUM_ENTRY = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*(\\((.*)\\))?.*$", Pattern.DOTALL);

    private final ExpressionRewriter rewriter = ExpressionRewriter.plain();

    public String generate(SourceDeclaration d, GenerationContext ctx) {
        if (d == null) throw new IllegalArgumentException("declaration must not be null");
        if (ctx == null) throw new IllegalArgumentException("ctx must not be null");
        switch (d.kind) {
            case FUNCTION:
                return function(d, "", false, ctx) + "\n";
            case PROPERTY:
                return property(d, "", false, ctx) + "\n";
            default:
                return withNestedTypes(d, classLike(d, ctx), ctx);
        }
    }

    private String classLike(SourceDeclaration d, GenerationContext ctx) {
        switch (d.kind) {
            case DATA_CLASS:
                return dataClass(d, null, ctx);
            case SEALED_CLASS:
                return sealedClass(d, ctx);
            case ENUM_CLASS:
                return enumClass(d, ctx);
            case INTERFACE:
                return interfaceClass(d, ctx);
            case OBJECT:
                return objectClass(d, null, ctx);
            default:
                return regularClass(d, null, ctx);
        }
    }

    // The target has no nested classes: nested types follow their owner at top level.
    private String withNestedTypes(SourceDeclaration d, String code, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder(code);
        for (SourceDeclaration m : d.members) {
            if (!m.kind.isClassLike()) continue;
            if (d.kind == DeclarationKind.SEALED_CLASS && extendsType(m, d.name)) continue;
            sb.append('\n').append(generate(m, ctx));
        }
        return sb.toString();
    }

    private String dataClass(SourceDeclaration d, String superClass, GenerationContext ctx) {
        List<Field> fields = constructorFields(d, ctx);
        StringBuilder sb = new StringBuilder();
        sb.append("class ").append(d.name).append(heritage(d, superClass, ctx)).append(" {\n");
        appendFields(sb, fields);
        appendConstructor(sb, d.name, fields, true);

        if (!fields.isEmpty()) {
            sb.append('\n');
            sb.append("  ").append(d.name).append(" copyWith({\n");
            for (Field f : fields) {
                sb.append("    ").append(f.nullableType()).append(' ').append(f.name).append(",\n");
            }
            sb.append("  }) {\n");
            sb.append("    return ").append(d.name).append("(\n");
            for (Field f : fields) {
                sb.append("      ").append(f.name).append(": ").append(f.name).append(" ?? this.").append(f.name).append(",\n");
            }
            sb.append("    );\n");
            sb.append("  }\n");
        }

        List<String> shown = new ArrayList<>();
        List<String> equal = new ArrayList<>();
        List<String> hashed = new ArrayList<>();
        for (Field f : fields) {
            shown.add(f.name + ": $" + f.name);
            equal.add("other." + f.name + " == " + f.name);
            hashed.add(f.name);
        }
        sb.append('\n');
        sb.append("  @override\n");
        sb.append("  String toString() => '").append(d.name).append("(").append(String.join(", ", shown)).append(")';\n");
        sb.append('\n');
        sb.append("  @override\n");
        sb.append("  bool operator ==(Object other) =>\n");
        sb.append("      identical(this, other) ||\n");
        sb.append("      other is ").append(d.name).append(" &&\n");
        sb.append("          runtimeType == other.runtimeType");
        for (String e : equal) sb.append(" &&\n          ").append(e);
        sb.append(";\n");
        sb.append('\n');
        sb.append("  @override\n");
        sb.append("  int get hashCode => ").append(hash(hashed)).append(";\n");
        appendMembers(sb, d, false, ctx);
        return sb.append("}\n").toString();
    }

    private static String hash(List<String> names) {
        if (names.isEmpty()) return "runtimeType.hashCode";
        if (names.size() == 1) return names.get(0) + ".hashCode";
        if (names.size() <= 20) return "Object.hash(" + String.join(", ", names) + ")";
        return "Object.hashAll([" + String.join(", ", names) + "])";
    }

    private String sealedClass(SourceDeclaration d, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("sealed class ").append(d.name).append(" {\n");
        sb.append("  const ").append(d.name).append("();\n");
        List<SourceDeclaration> subtypes = new ArrayList<>();
        List<SourceDeclaration> others = new ArrayList<>();
        for (SourceDeclaration m : d.members) {
            if (m.kind.isClassLike() && extendsType(m, d.name)) subtypes.add(m);
            else others.add(m);
        }
        appendMembers(sb, others, false, ctx);
        sb.append("}\n");
        for (SourceDeclaration s : subtypes) {
            sb.append('\n');
            if (s.kind == DeclarationKind.DATA_CLASS) {
                sb.append(dataClass(s, d.name, ctx));
            } else if (s.kind == DeclarationKind.OBJECT) {
                sb.append(singletonSubtype(s, d.name, ctx));
            } else {
                sb.append(regularClass(s, d.name, ctx));
            }
        }
        return sb.toString();
    }

    // A sealed subtype object is a constant instance with no state.
    private String singletonSubtype(SourceDeclaration d, String superClass, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("class ").append(d.name).append(" extends ").append(superClass).append(" {\n");
        sb.append("  const ").append(d.name).append("();\n");
        appendMembers(sb, d, false, ctx);
        return sb.append("}\n").toString();
    }

    private static boolean extendsType(SourceDeclaration d, String name) {
        for (String s : d.superTypes) {
            String base = s.trim();
            int paren = base.indexOf('(');
            if (paren >= 0) base = base.substring(0, paren);
            int lt = base.indexOf('<');
            if (lt >= 0) base = base.substring(0, lt);
            if (base.trim().equals(name) || base.trim().endsWith("." + name)) return true;
        }
        return false;
    }

    private String enumClass(SourceDeclaration d, GenerationContext ctx) {
        List<Field> fields = constructorFields(d, ctx);
        List<String> entries = new ArrayList<>();
        for (String e : d.enumEntries) {
            Matcher m = ENUM_ENTRY.matcher(e.trim());
            if (!m.matches()) continue;
            String name = enumConstant(m.group(1));
            entries.add(m.group(2) == null || fields.isEmpty() ? name : name + "(" + rewriter.rewrite(m.group(3)) + ")");
        }
        StringBuilder sb = new StringBuilder();
        sb.append("enum ").append(d.name).append(" {\n");
        if (fields.isEmpty() && d.members.isEmpty()) {
            for (int i = 0; i < entries.size(); i++) {
                sb.append("  ").append(entries.get(i)).append(i + 1 < entries.size() ? ",\n" : "\n");
            }
            return sb.append("}\n").toString();
        }
        for (int i = 0; i < entries.size(); i++) {
            sb.append("  ").append(entries.get(i)).append(i + 1 < entries.size() ? ",\n" : ";\n");
        }
        if (entries.isEmpty()) sb.append("  ;\n");
        sb.append('\n');
        for (Field f : fields) sb.append("  final ").append(f.type).append(' ').append(f.name).append(";\n");
        if (!fields.isEmpty()) {
            List<String> params = new ArrayList<>();
            for (Field f : fields) params.add("this." + f.name);
            sb.append('\n');
            sb.append("  const ").append(d.name).append("(").append(String.join(", ", params)).append(");\n");
        }
        appendMembers(sb, d, false, ctx);
        return sb.append("}\n").toString();
    }

    /** {@code IN_PROGRESS} -> {@code inProgress}; already camel-cased names are lower-firsted. */
    static String enumConstant(String name) {
        if (!name.equals(name.toUpperCase())) return ExpressionRewriter.lowerFirst(name);
        StringBuilder sb = new StringBuilder();
        boolean upper = false;
        for (char c : name.toLowerCase().toCharArray()) {
            if (c == '_') {
                upper = sb.length() > 0;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }

    private String interfaceClass(SourceDeclaration d, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("abstract class ").append(d.name).append(implementsClause(d.superTypes, ctx)).append(" {\n");
        boolean first = true;
        for (SourceDeclaration m : d.members) {
            if (!first) sb.append('\n');
            first = false;
            if (m.kind == DeclarationKind.FUNCTION) {
                sb.append(m.body == null ? abstractMethod(m, ctx) : function(m, "  ", false, ctx)).append('\n');
            } else if (m.kind == DeclarationKind.PROPERTY) {
                sb.append(m.initializer == null
                        ? "  " + propertyType(m, ctx) + " get " + m.name + ";"
                        : property(m, "  ", false, ctx)).append('\n');
            }
        }
        return sb.append("}\n").toString();
    }

    private String abstractMethod(SourceDeclaration m, GenerationContext ctx) {
        return "  " + returnType(m, ctx) + " " + m.name + "(" + parameterList(m.parameters, ctx, m.name) + ");";
    }

    private String objectClass(SourceDeclaration d, String superClass, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("class ").append(d.name).append(heritage(d, superClass, ctx)).append(" {\n");
        sb.append("  ").append(d.name).append("._();\n");
        appendMembers(sb, d, true, ctx);
        return sb.append("}\n").toString();
    }

    private String regularClass(SourceDeclaration d, String superClass, GenerationContext ctx) {
        List<Field> fields = constructorFields(d, ctx);
        StringBuilder sb = new StringBuilder();
        if (d.hasModifier("abstract")) sb.append("abstract ");
        sb.append("class ").append(d.name).append(heritage(d, superClass, ctx)).append(" {\n");
        appendFields(sb, fields);
        appendConstructor(sb, d.name, fields, false);
        appendMembers(sb, d, false, ctx);
        return sb.append("}\n").toString();
    }

    /** Extends the first supertype written as a constructor call, implements the rest. */
    private String heritage(SourceDeclaration d, String superClass, GenerationContext ctx) {
        String extendsName = superClass;
        List<String> interfaces = new ArrayList<>();
        for (String s : d.superTypes) {
            String t = s.trim();
            int paren = t.indexOf('(');
            String name = paren >= 0 ? t.substring(0, paren).trim() : t;
            if (superClass != null && (name.equals(superClass) || name.endsWith("." + superClass))) continue;
            if (paren >= 0 && extendsName == null) {
                extendsName = ctx.mapType(name, d.name);
            } else {
                interfaces.add(name);
            }
        }
        StringBuilder sb = new StringBuilder();
        if (extendsName != null) sb.append(" extends ").append(extendsName);
        sb.append(implementsClause(interfaces, ctx));
        return sb.toString();
    }

    private static String implementsClause(List<String> interfaces, GenerationContext ctx) {
        if (interfaces.isEmpty()) return "";
        List<String> mapped = new ArrayList<>();
        for (String i : interfaces) mapped.add(ctx.types.map(i));
        return " implements " + String.join(", ", mapped);
    }

    private List<Field> constructorFields(SourceDeclaration d, GenerationContext ctx) {
        List<Field> out = new ArrayList<>();
        for (SourceParameter p : d.parameters) {
            String type = ctx.mapType(p.type, d.name);
            String dflt = p.hasDefault() ? rewriter.rewrite(p.defaultValue) : null;
            if (dflt != null && (dflt.startsWith("[") || dflt.startsWith("{"))) dflt = "const " + dflt;
            out.add(new Field(p.name, type, p.nullable || type.endsWith("?"), p.mutable, dflt));
        }
        return out;
    }

    private static void appendFields(StringBuilder sb, List<Field> fields) {
        for (Field f : fields) {
            sb.append("  ").append(f.mutable ? "" : "final ").append(f.type).append(' ').append(f.name).append(";\n");
        }
        if (!fields.isEmpty()) sb.append('\n');
    }

    private static void appendConstructor(StringBuilder sb, String name, List<Field> fields, boolean constant) {
        boolean canBeConst = constant;
        for (Field f : fields) canBeConst &= !f.mutable;
        String prefix = canBeConst ? "const " : "";
        if (fields.isEmpty()) {
            sb.append("  ").append(prefix).append(name).append("();\n");
            return;
        }
        sb.append("  ").append(prefix).append(name).append("({\n");
        for (Field f : fields) {
            sb.append("    ");
            if (f.defaultValue != null) {
                sb.append("this.").append(f.name).append(" = ").append(f.defaultValue);
            } else if (f.nullable) {
                sb.append("this.").append(f.name);
            } else {
                sb.append("required this.").append(f.name);
            }
            sb.append(",\n");
        }
        sb.append("  });\n");
    }

    private void appendMembers(StringBuilder sb, SourceDeclaration d, boolean statics, GenerationContext ctx) {
        appendMembers(sb, d.members, statics, ctx);
    }

    private void appendMembers(StringBuilder sb, List<SourceDeclaration> members, boolean statics, GenerationContext ctx) {
        for (SourceDeclaration m : members) {
            if (m.kind == DeclarationKind.FUNCTION && !m.isComposable()) {
                sb.append('\n').append(function(m, "  ", statics, ctx)).append('\n');
            } else if (m.kind == DeclarationKind.PROPERTY) {
                sb.append('\n').append(property(m, "  ", statics, ctx)).append('\n');
            }
        }
    }

    String function(SourceDeclaration f, String indent, boolean statics, GenerationContext ctx) {
        boolean suspend = f.hasModifier("suspend");
        String ret = returnType(f, ctx);
        if (suspend && !ret.startsWith("Future")) ret = "Future<" + ret + ">";
        StringBuilder sb = new StringBuilder(indent);
        if (statics) sb.append("static ");
        if (f.hasModifier("override")) sb.insert(0, indent + "@override\n");
        sb.append(ret).append(' ').append(f.name).append('(').append(parameterList(f.parameters, ctx, f.name)).append(')');
        if (suspend) sb.append(" async");
        if (f.body == null) {
            return sb.append(" {}").toString();
        }
        if (!(f.body instanceof SourceExpr.Block block)) {
            return sb.append(" => ").append(rewriter.rewrite(f.body.text)).append(';').toString();
        }
        sb.append(" {\n");
        for (String s : statements(block, ctx)) {
            for (String line : s.split("\n")) {
                sb.append(indent).append("  ").append(line.stripTrailing()).append('\n');
            }
        }
        return sb.append(indent).append('}').toString();
    }

    private List<String> statements(SourceExpr.Block block, GenerationContext ctx) {
        List<String> out = new ArrayList<>();
        for (SourceExpr s : block.statements) {
            String text = s.text.trim();
            if (text.isEmpty()) continue;
            Matcher m = LOCAL_DECLARATION.matcher(text);
            if (m.find()) {
                String local = ctx.types.map(m.group(2));
                text = local + " " + m.group(1) + " =" + text.substring(m.end());
            }
            String converted = rewriter.rewrite(text);
            out.add(converted.endsWith("}") || converted.endsWith(";") ? converted : converted + ";");
        }
        return out;
    }

    String property(SourceDeclaration p, String indent, boolean statics, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder(indent);
        if (statics) sb.append("static ");
        boolean typed = p.type != null && !p.type.isBlank();
        String type = typed ? ctx.mapType(p.type, p.name) : null;
        if (p.mutable) {
            sb.append(typed ? type : "var");
        } else {
            sb.append("final");
            if (typed) sb.append(' ').append(type);
        }
        sb.append(' ').append(p.name);
        if (p.initializer != null && !p.initializer.isBlank()) {
            sb.append(" = ").append(rewriter.rewrite(p.initializer));
        } else if (typed && !type.endsWith("?") && !type.equals("dynamic")) {
            sb.insert(indent.length() + (statics ? "static ".length() : 0), "late ");
        }
        return sb.append(';').toString();
    }

    private String propertyType(SourceDeclaration p, GenerationContext ctx) {
        return p.type == null || p.type.isBlank() ? "dynamic" : ctx.mapType(p.type, p.name);
    }

    private String returnType(SourceDeclaration f, GenerationContext ctx) {
        if (f.returnType == null || f.returnType.isBlank()) {
            return f.body == null || f.body instanceof SourceExpr.Block ? "void" : "dynamic";
        }
        return ctx.mapType(f.returnType, f.name);
    }

    private String parameterList(List<SourceParameter> params, GenerationContext ctx, String owner) {
        List<String> required = new ArrayList<>();
        List<String> optional = new ArrayList<>();
        for (SourceParameter p : params) {
            String type = ctx.mapType(p.type, owner);
            if (p.hasDefault()) {
                optional.add(type + " " + p.name + " = " + rewriter.rewrite(p.defaultValue));
            } else {
                required.add(type + " " + p.name);
            }
        }
        String out = String.join(", ", required);
        if (!optional.isEmpty()) {
            out += (out.isEmpty() ? "" : ", ") + "[" + String.join(", ", optional) + "]";
        }
        return out;
    }

    private static final class Field {
        final String name;
        final String type;
        final boolean nullable;
        final boolean mutable;
        final String defaultValue;

        Field(String name, String type, boolean nullable, boolean mutable, String defaultValue) {
            this.name = name;
            this.type = type;
            this.nullable = nullable;
            this.mutable = mutable;
            this.defaultValue = defaultValue;
        }

        String nullableType() {
            return type.endsWith("?") || type.equals("dynamic") ? type : type + "?";
        }
    }
}
