package info.isaksson.erland.composetoflutter.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Symbol name (simple or qualified) to owning unit path.
 *
 * <p>Registration order is kept. When two units define the same name, the last registration
 * wins; the key keeps its original position, so wildcard lookups stay stable.</p>
 */
public final class SymbolTable {

    private final Map<String, String> owners = new LinkedHashMap<>();

    void register(String symbol, String unitPath) {
        if (symbol == null || symbol.isBlank()) return;
        owners.put(symbol, unitPath);
    }

    public String ownerOf(String symbol) {
        return owners.get(symbol);
    }

    /**
     * Resolve an import path to a unit: exact symbol, then wildcard package prefix (first
     * registered symbol under it), then the trailing identifier.
     */
    public String resolveImport(String importPath) {
        if (importPath == null) return null;
        String imp = stripAlias(importPath.trim());
        String exact = owners.get(imp);
        if (exact != null) return exact;

        if (imp.endsWith("*")) {
            String prefix = imp.substring(0, imp.length() - 1);
            for (Map.Entry<String, String> e : owners.entrySet()) {
                if (e.getKey().startsWith(prefix)) return e.getValue();
            }
            return null;
        }
        return owners.get(trailingIdentifier(imp));
    }

    /** Resolve a type reference: exact name, then its trailing identifier. */
    public String resolveType(String typeName) {
        if (typeName == null) return null;
        String exact = owners.get(typeName);
        if (exact != null) return exact;
        return owners.get(trailingIdentifier(typeName));
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(owners);
    }

    static String trailingIdentifier(String path) {
        int dot = path.lastIndexOf('.');
        return dot >= 0 ? path.substring(dot + 1) : path;
    }

    private static String stripAlias(String imp) {
        int as = imp.indexOf(" as ");
        return as > 0 ? imp.substring(0, as).trim() : imp;
    }
}
