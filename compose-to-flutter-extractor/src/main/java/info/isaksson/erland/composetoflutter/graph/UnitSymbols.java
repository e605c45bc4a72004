package info.isaksson.erland.composetoflutter.graph;

import java.util.List;
import java.util.Set;

/** Symbols defined and referenced by a single unit. */
public final class UnitSymbols {
    public final String path;
    public final String packageName;
    public final List<String> imports;
    public final Set<String> definedClasses;
    public final Set<String> definedFunctions;
    public final Set<String> referencedTypes;
    public final boolean hasUiContent;
    public final int complexity;

    UnitSymbols(String path, String packageName, List<String> imports, Set<String> definedClasses,
                Set<String> definedFunctions, Set<String> referencedTypes, boolean hasUiContent, int complexity) {
        this.path = path;
        this.packageName = packageName;
        this.imports = List.copyOf(imports);
        this.definedClasses = Set.copyOf(definedClasses);
        this.definedFunctions = Set.copyOf(definedFunctions);
        this.referencedTypes = Set.copyOf(referencedTypes);
        this.hasUiContent = hasUiContent;
        this.complexity = complexity;
    }
}
