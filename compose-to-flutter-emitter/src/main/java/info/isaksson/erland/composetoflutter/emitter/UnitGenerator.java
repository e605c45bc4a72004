package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.ir.DeclarationKind;
import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceUnit;
import info.isaksson.erland.composetoflutter.ir.UiTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Assembles the target file for one unit: header, imports, then every declaration in
 * source order, with components rendered by {@link CodeGenerator} and everything else by
 * {@link DeclarationGenerator}.
 */
public final class UnitGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(UnitGenerator.class);

    private final CodeGenerator components = new CodeGenerator();
    private final DeclarationGenerator declarations = new DeclarationGenerator();

    /**
     * @param trees             UI trees of the unit's components
     * @param dependencyImports relative import paths of the units this one depends on
     */
    public GeneratedUnit generate(SourceUnit unit, List<UiTree> trees, List<String> dependencyImports, GenerationContext ctx) {
        if (unit == null) throw new IllegalArgumentException("unit must not be null");
        if (ctx == null) throw new IllegalArgumentException("ctx must not be null");

        Map<String, UiTree> byName = new LinkedHashMap<>();
        if (trees != null) {
            for (UiTree t : trees) byName.put(t.name, t);
        }

        List<String> blocks = new ArrayList<>();
        List<GeneratedComponent> generated = new ArrayList<>();
        for (SourceDeclaration d : unit.declarations) {
            UiTree tree = d.kind == DeclarationKind.FUNCTION ? byName.get(d.name) : null;
            if (tree != null) {
                GeneratedComponent c = components.generate(tree, ctx);
                generated.add(c);
                blocks.add(c.code);
            } else if (!d.isComposable()) {
                blocks.add(declarations.generate(d, ctx));
            }
        }

        List<String> imports = sortImports(ctx, dependencyImports);
        StringBuilder sb = new StringBuilder();
        if (ctx.options.sourceComments) {
            sb.append("// Converted from ").append(unit.path).append("\n\n");
        }
        for (String i : imports) sb.append("import '").append(i).append("';\n");
        if (!imports.isEmpty()) sb.append('\n');
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(blocks.get(i));
        }

        ComponentShape shape = shape(generated);
        LOG.debug("Generated {} ({} component(s), {} declaration block(s), shape {})",
                unit.path, generated.size(), blocks.size(), shape);
        return new GeneratedUnit(imports, shape, generated, sb.toString());
    }

    static ComponentShape shape(List<GeneratedComponent> components) {
        if (components.isEmpty()) return ComponentShape.NONE;
        for (GeneratedComponent c : components) {
            if (c.shape == ComponentShape.STATEFUL) return ComponentShape.STATEFUL;
        }
        return ComponentShape.STATELESS;
    }

    /** Platform imports first, then packages, then relative paths; each group sorted. */
    static List<String> sortImports(GenerationContext ctx, List<String> dependencyImports) {
        TreeSet<String> platform = new TreeSet<>();
        TreeSet<String> packages = new TreeSet<>();
        TreeSet<String> relative = new TreeSet<>();
        List<String> all = new ArrayList<>(ctx.requiredImports());
        if (dependencyImports != null) all.addAll(dependencyImports);
        for (String i : all) {
            if (i.startsWith("dart:")) platform.add(i);
            else if (i.startsWith("package:")) packages.add(i);
            else relative.add(i);
        }
        List<String> out = new ArrayList<>(platform);
        out.addAll(packages);
        out.addAll(relative);
        return out;
    }
}
