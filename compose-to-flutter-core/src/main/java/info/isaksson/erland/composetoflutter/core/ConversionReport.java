package info.isaksson.erland.composetoflutter.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.composetoflutter.emitter.GenerationWarning;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Diagnostics of one project conversion: statistics, schedule, cycles, per-unit
 * complexity, errors and warnings. {@link #success} is true iff there are no errors.
 */
@JsonPropertyOrder({"projectName","success","stats","order","cycles","complexity","units","errors","warnings"})
public final class ConversionReport {
    public final String projectName;
    public final boolean success;
    public final Stats stats;

    /** Conversion order (unit paths). */
    public final List<String> order;

    public final List<List<String>> cycles;

    /** Unit path to complexity score, sorted by path. */
    public final Map<String, Integer> complexity;

    /** One entry per converted unit, in conversion order. */
    public final List<UnitSummary> units;

    public final List<ConversionError> errors;
    public final List<GenerationWarning> warnings;

    public ConversionReport(
            String projectName,
            Stats stats,
            List<String> order,
            List<List<String>> cycles,
            Map<String, Integer> complexity,
            List<UnitSummary> units,
            List<ConversionError> errors,
            List<GenerationWarning> warnings
    ) {
        this.projectName = projectName == null ? "" : projectName;
        this.stats = stats;
        this.order = order == null ? List.of() : List.copyOf(order);
        this.cycles = cycles == null ? List.of() : List.copyOf(cycles);
        this.complexity = complexity == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(complexity));
        this.units = units == null ? List.of() : List.copyOf(units);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.success = this.errors.isEmpty();
    }

    @JsonPropertyOrder({"totalUnits","convertedUnits","failedUnits","aiAssistedUnits","components",
            "sourceLines","generatedLines","warnings"})
    public static final class Stats {
        public final int totalUnits;
        public final int convertedUnits;
        public final int failedUnits;
        public final int aiAssistedUnits;
        public final int components;
        public final int sourceLines;
        public final int generatedLines;
        public final int warnings;

        public Stats(int totalUnits, int convertedUnits, int failedUnits, int aiAssistedUnits, int components,
                     int sourceLines, int generatedLines, int warnings) {
            this.totalUnits = totalUnits;
            this.convertedUnits = convertedUnits;
            this.failedUnits = failedUnits;
            this.aiAssistedUnits = aiAssistedUnits;
            this.components = components;
            this.sourceLines = sourceLines;
            this.generatedLines = generatedLines;
            this.warnings = warnings;
        }
    }

    /** Report view of a {@link UnitOutput}, without the code. */
    @JsonPropertyOrder({"unitPath","targetPath","priority","complexity","shape","generationMethod","components",
            "sourceLines","generatedLines"})
    public static final class UnitSummary {
        public final String unitPath;
        public final String targetPath;
        public final String priority;
        public final int complexity;
        public final String shape;
        public final String generationMethod;
        public final List<String> components;
        public final int sourceLines;
        public final int generatedLines;

        UnitSummary(UnitOutput out) {
            this.unitPath = out.unitPath;
            this.targetPath = out.targetPath;
            this.priority = out.priority == null ? null : out.priority.name();
            this.complexity = out.complexity;
            this.shape = out.shape.name();
            this.generationMethod = out.generationMethod.name();
            this.components = out.components;
            this.sourceLines = out.sourceLineCount;
            this.generatedLines = out.generatedLineCount;
        }
    }
}
