package info.isaksson.erland.composetoflutter.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Result of scheduling: safe order, prioritized tasks and diagnostics. */
public final class ConversionPlan {
    /** Dependencies first: for every edge A -> B outside a cycle, B precedes A. */
    public final List<String> order;
    public final List<ConversionTask> tasks;
    public final List<List<String>> cycles;
    /** Unit path to complexity score, in registration order. */
    public final Map<String, Integer> complexity;
    public final DependencyGraph graph;

    ConversionPlan(List<String> order, List<ConversionTask> tasks, List<List<String>> cycles,
                   Map<String, Integer> complexity, DependencyGraph graph) {
        this.order = List.copyOf(order);
        this.tasks = List.copyOf(tasks);
        this.cycles = List.copyOf(cycles);
        this.complexity = Collections.unmodifiableMap(new LinkedHashMap<>(complexity));
        this.graph = graph;
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    public ConversionTask task(String unitPath) {
        for (ConversionTask t : tasks) {
            if (t.unitPath.equals(unitPath)) return t;
        }
        return null;
    }
}
