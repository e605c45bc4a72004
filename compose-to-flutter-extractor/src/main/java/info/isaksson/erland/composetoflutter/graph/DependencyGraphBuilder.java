package info.isaksson.erland.composetoflutter.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the unit dependency graph from a {@link SymbolIndex}.
 *
 * <p>Imports and referenced type names are resolved through the symbol table. Anything that
 * does not resolve to a project unit (platform and library imports) adds no edge.</p>
 */
public final class DependencyGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public DependencyGraph build(SymbolIndex index) {
        if (index == null) throw new IllegalArgumentException("index must not be null");
        DependencyGraph graph = new DependencyGraph();
        SymbolTable table = index.table();

        for (UnitSymbols unit : index.units()) {
            graph.addNode(unit.path);
        }
        for (UnitSymbols unit : index.units()) {
            for (String imp : unit.imports) {
                String target = table.resolveImport(imp);
                if (target == null) {
                    LOG.debug("Import {} in {} is external", imp, unit.path);
                    continue;
                }
                graph.addEdge(unit.path, target);
            }
            for (String type : unit.referencedTypes) {
                String target = table.resolveType(type);
                if (target != null) graph.addEdge(unit.path, target);
            }
        }
        LOG.debug("Dependency graph: {} units, {} edges", graph.nodes().size(), graph.edgeCount());
        return graph;
    }
}
