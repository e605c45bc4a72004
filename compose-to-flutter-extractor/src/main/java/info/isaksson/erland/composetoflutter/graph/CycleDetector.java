package info.isaksson.erland.composetoflutter.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Depth-first cycle finder. Each back-edge yields the path from the repeated unit through
 * the closing edge, e.g. {@code [A, B, C, A]}.
 */
public final class CycleDetector {

    private CycleDetector() {}

    public static List<List<String>> findCycles(DependencyGraph graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        List<String> path = new ArrayList<>();
        for (String node : graph.nodes()) {
            if (!visited.contains(node)) {
                dfs(graph, node, visited, onStack, path, cycles);
            }
        }
        return cycles;
    }

    private static void dfs(DependencyGraph graph, String node, Set<String> visited, Set<String> onStack,
                            List<String> path, List<List<String>> cycles) {
        visited.add(node);
        onStack.add(node);
        path.add(node);
        for (String dep : graph.dependenciesOf(node)) {
            if (!visited.contains(dep)) {
                dfs(graph, dep, visited, onStack, path, cycles);
            } else if (onStack.contains(dep)) {
                int start = path.indexOf(dep);
                List<String> cycle = new ArrayList<>(path.subList(start, path.size()));
                cycle.add(dep);
                cycles.add(List.copyOf(cycle));
            }
        }
        path.remove(path.size() - 1);
        onStack.remove(node);
    }
}
