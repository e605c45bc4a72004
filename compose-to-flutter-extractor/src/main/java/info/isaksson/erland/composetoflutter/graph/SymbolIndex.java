package info.isaksson.erland.composetoflutter.graph;

import info.isaksson.erland.composetoflutter.ir.DeclarationKind;
import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceParameter;
import info.isaksson.erland.composetoflutter.ir.SourceProject;
import info.isaksson.erland.composetoflutter.ir.SourceUnit;
import info.isaksson.erland.composetoflutter.ir.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Project-wide symbol index: what each unit defines and references, plus the shared
 * {@link SymbolTable}.
 */
public final class SymbolIndex {

    /** Capitalized identifier followed by '(', '<' or '.', e.g. constructor or static calls. */
    private static final Pattern BODY_TYPE_REF = Pattern.compile("([A-Z][a-zA-Z0-9_]*)\\s*[(<.]");

    private final Map<String, UnitSymbols> units;
    private final SymbolTable table;

    private SymbolIndex(Map<String, UnitSymbols> units, SymbolTable table) {
        this.units = Collections.unmodifiableMap(units);
        this.table = table;
    }

    public static SymbolIndex build(SourceProject project) {
        if (project == null) throw new IllegalArgumentException("project must not be null");
        Map<String, UnitSymbols> units = new LinkedHashMap<>();
        SymbolTable table = new SymbolTable();
        for (SourceUnit unit : project.units) {
            UnitSymbols symbols = analyzeUnit(unit);
            units.put(unit.path, symbols);
            for (String cls : symbols.definedClasses) {
                table.register(cls, unit.path);
                table.register(unit.qualify(cls), unit.path);
            }
            for (String fn : symbols.definedFunctions) {
                table.register(fn, unit.path);
                table.register(unit.qualify(fn), unit.path);
            }
        }
        return new SymbolIndex(units, table);
    }

    /** Units in registration order. */
    public List<UnitSymbols> units() {
        return List.copyOf(units.values());
    }

    public UnitSymbols unit(String path) {
        return units.get(path);
    }

    public SymbolTable table() {
        return table;
    }

    static UnitSymbols analyzeUnit(SourceUnit unit) {
        // LinkedHashSet keeps discovery order; UnitSymbols copies into immutable sets.
        Set<String> classes = new LinkedHashSet<>();
        Set<String> functions = new LinkedHashSet<>();
        Set<String> referenced = new LinkedHashSet<>();
        boolean ui = false;

        for (SourceDeclaration d : unit.declarations) {
            switch (d.kind) {
                case FUNCTION:
                    functions.add(d.name);
                    if (d.isComposable()) ui = true;
                    collectSignature(d, referenced);
                    if (d.body != null) collectFromBody(d.body.text, referenced);
                    break;
                case PROPERTY:
                    addTypeRefs(d.type, referenced);
                    break;
                default:
                    collectClass(d, d.name, classes, referenced);
                    break;
            }
        }

        referenced.removeIf(KnownNames::isExcluded);
        // Own definitions are not references.
        referenced.removeAll(classes);
        return new UnitSymbols(unit.path, unit.packageName, unit.imports, classes, functions, referenced,
                ui, ComplexityCalculator.unitComplexity(unit));
    }

    private static void collectClass(SourceDeclaration d, String qualifiedPath, Set<String> classes, Set<String> referenced) {
        classes.add(qualifiedPath);
        for (String superType : d.superTypes) {
            // "Base(arg)" or "Base<T>" -> Base, plus generic arguments
            String s = superType;
            int paren = s.indexOf('(');
            if (paren > 0) s = s.substring(0, paren);
            addTypeRefs(s, referenced);
        }
        for (SourceParameter p : d.parameters) addTypeRefs(p.type, referenced);
        for (SourceDeclaration m : d.members) {
            if (m.kind.isClassLike()) {
                collectClass(m, qualifiedPath + "." + m.name, classes, referenced);
            } else if (m.kind == DeclarationKind.PROPERTY) {
                addTypeRefs(m.type, referenced);
            } else {
                collectSignature(m, referenced);
            }
        }
    }

    private static void collectSignature(SourceDeclaration fn, Set<String> referenced) {
        for (SourceParameter p : fn.parameters) addTypeRefs(p.type, referenced);
        addTypeRefs(fn.returnType, referenced);
    }

    private static void addTypeRefs(String typeText, Set<String> out) {
        if (typeText == null || typeText.isBlank()) return;
        for (String name : TypeDescriptor.parse(typeText).referencedNames()) {
            String simple = SymbolTable.trailingIdentifier(name);
            if (!simple.isEmpty() && Character.isUpperCase(simple.charAt(0))) {
                out.add(name);
            }
        }
    }

    static void collectFromBody(String body, Set<String> out) {
        if (body == null || body.isEmpty()) return;
        Matcher m = BODY_TYPE_REF.matcher(body);
        List<String> found = new ArrayList<>();
        while (m.find()) {
            found.add(m.group(1));
        }
        for (String name : found) {
            if (!KnownNames.isExcluded(name)) out.add(name);
        }
    }
}
