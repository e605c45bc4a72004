package info.isaksson.erland.composetoflutter.core;

import info.isaksson.erland.composetoflutter.graph.ConversionPlan;
import info.isaksson.erland.composetoflutter.ir.UiTree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversion result container for programmatic usage. */
public final class ConversionResult {

    /** Generated files of the units that converted, in conversion order. */
    public final List<UnitOutput> outputs;

    /** Extracted UI trees by unit path, in conversion order. Units without components are absent. */
    public final Map<String, List<UiTree>> trees;

    public final ConversionPlan plan;
    public final ConversionReport report;

    ConversionResult(List<UnitOutput> outputs, Map<String, List<UiTree>> trees, ConversionPlan plan, ConversionReport report) {
        this.outputs = List.copyOf(outputs);
        this.trees = Collections.unmodifiableMap(new LinkedHashMap<>(trees));
        this.plan = plan;
        this.report = report;
    }

    public UnitOutput output(String unitPath) {
        for (UnitOutput o : outputs) {
            if (o.unitPath.equals(unitPath)) return o;
        }
        return null;
    }
}
