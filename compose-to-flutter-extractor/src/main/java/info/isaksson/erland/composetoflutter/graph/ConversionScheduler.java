package info.isaksson.erland.composetoflutter.graph;

import info.isaksson.erland.composetoflutter.ir.SourceProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes a dependencies-first conversion order and a prioritized task list.
 *
 * <p>Scheduling never blocks on cycles: units that Kahn's algorithm cannot release are
 * appended in registration order, and the cycles are reported separately.</p>
 */
public final class ConversionScheduler {

    public static final int DEFAULT_COMPLEXITY_THRESHOLD = 20;

    private static final Logger LOG = LoggerFactory.getLogger(ConversionScheduler.class);

    private final int complexityThreshold;

    public ConversionScheduler() {
        this(DEFAULT_COMPLEXITY_THRESHOLD);
    }

    public ConversionScheduler(int complexityThreshold) {
        this.complexityThreshold = complexityThreshold;
    }

    /** Index, graph and plan in one step. */
    public ConversionPlan plan(SourceProject project) {
        SymbolIndex index = SymbolIndex.build(project);
        return plan(index, new DependencyGraphBuilder().build(index));
    }

    public ConversionPlan plan(SymbolIndex index, DependencyGraph graph) {
        if (index == null) throw new IllegalArgumentException("index must not be null");
        if (graph == null) throw new IllegalArgumentException("graph must not be null");

        List<String> order = topologicalOrder(graph);
        List<List<String>> cycles = CycleDetector.findCycles(graph);
        for (List<String> cycle : cycles) {
            LOG.warn("Dependency cycle: {}", String.join(" -> ", cycle));
        }

        Map<String, Integer> complexity = new LinkedHashMap<>();
        for (UnitSymbols u : index.units()) {
            complexity.put(u.path, u.complexity);
        }

        List<ConversionTask> tasks = new ArrayList<>();
        for (String path : order) {
            UnitSymbols u = index.unit(path);
            if (u == null) continue;
            int deps = graph.dependenciesOf(path).size();
            ConversionPriority priority;
            if (deps == 0) priority = ConversionPriority.HIGH;
            else if (u.hasUiContent) priority = ConversionPriority.MEDIUM;
            else priority = ConversionPriority.LOW;
            boolean requiresAi = u.complexity > complexityThreshold || u.hasUiContent;
            tasks.add(new ConversionTask(path, priority, deps, u.complexity, requiresAi));
        }
        // List.sort is stable: ties keep topological order.
        tasks.sort(Comparator
                .comparing((ConversionTask t) -> t.priority)
                .thenComparingInt(t -> t.dependencyCount)
                .thenComparingInt(t -> t.complexity));

        return new ConversionPlan(order, tasks, cycles, complexity, graph);
    }

    /**
     * Kahn's algorithm over outgoing dependencies: a unit is released once every unit it
     * depends on has been released. Units that never release (cycle members and anything
     * depending on them) are appended in registration order.
     */
    static List<String> topologicalOrder(DependencyGraph graph) {
        List<String> nodes = graph.nodes();
        Map<String, Integer> pending = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (String n : nodes) {
            pending.put(n, graph.dependenciesOf(n).size());
            dependents.put(n, new ArrayList<>());
        }
        for (String n : nodes) {
            for (String dep : graph.dependenciesOf(n)) {
                dependents.get(dep).add(n);
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        for (String n : nodes) {
            if (pending.get(n) == 0) queue.add(n);
        }

        List<String> released = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String n = queue.removeFirst();
            released.add(n);
            seen.add(n);
            for (String dependent : dependents.get(n)) {
                int d = pending.merge(dependent, -1, Integer::sum);
                if (d == 0) queue.add(dependent);
            }
        }
        for (String n : nodes) {
            if (!seen.contains(n)) released.add(n);
        }
        return released;
    }
}
