package info.isaksson.erland.composetoflutter.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed unit graph. An edge {@code A -> B} means A depends on B. No self-edges.
 *
 * <p>Nodes and edge targets keep insertion order, so every traversal is deterministic for a
 * fixed input order.</p>
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

    void addNode(String unit) {
        dependencies.computeIfAbsent(unit, k -> new LinkedHashSet<>());
    }

    /** Returns true if the edge is new. Self-edges are ignored. */
    boolean addEdge(String from, String to) {
        if (from == null || to == null || from.equals(to)) return false;
        addNode(to);
        return dependencies.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }

    public List<String> nodes() {
        return List.copyOf(dependencies.keySet());
    }

    public Set<String> dependenciesOf(String unit) {
        Set<String> deps = dependencies.get(unit);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    /** Units that depend on {@code unit}, in node order. */
    public List<String> dependentsOf(String unit) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : dependencies.entrySet()) {
            if (e.getValue().contains(unit)) out.add(e.getKey());
        }
        return out;
    }

    public int edgeCount() {
        int n = 0;
        for (Set<String> deps : dependencies.values()) n += deps.size();
        return n;
    }

    public boolean hasEdge(String from, String to) {
        return dependenciesOf(from).contains(to);
    }
}
