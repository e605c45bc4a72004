package info.isaksson.erland.composetoflutter.core;

import info.isaksson.erland.composetoflutter.emitter.GeneratedComponent;
import info.isaksson.erland.composetoflutter.emitter.GeneratedUnit;
import info.isaksson.erland.composetoflutter.emitter.GenerationContext;
import info.isaksson.erland.composetoflutter.emitter.GenerationWarnings;
import info.isaksson.erland.composetoflutter.emitter.GeneratorOptions;
import info.isaksson.erland.composetoflutter.emitter.UnitGenerator;
import info.isaksson.erland.composetoflutter.extract.UiTreeExtractor;
import info.isaksson.erland.composetoflutter.graph.ConversionPlan;
import info.isaksson.erland.composetoflutter.graph.ConversionScheduler;
import info.isaksson.erland.composetoflutter.graph.ConversionTask;
import info.isaksson.erland.composetoflutter.graph.DependencyGraph;
import info.isaksson.erland.composetoflutter.graph.DependencyGraphBuilder;
import info.isaksson.erland.composetoflutter.graph.SymbolIndex;
import info.isaksson.erland.composetoflutter.graph.UnitSymbols;
import info.isaksson.erland.composetoflutter.ir.SourceDeclaration;
import info.isaksson.erland.composetoflutter.ir.SourceParameter;
import info.isaksson.erland.composetoflutter.ir.SourceProject;
import info.isaksson.erland.composetoflutter.ir.SourceUnit;
import info.isaksson.erland.composetoflutter.ir.UiTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Core (server-friendly) API for converting a project.
 *
 * <p>CLI and host integrations should use this class instead of re-implementing the pipeline:
 * index symbols, build the dependency graph, schedule, then extract and generate every unit
 * in schedule order. A unit that fails is reported as a {@link ConversionError} and the
 * remaining units still convert.</p>
 */
public final class ConversionService {

    private static final Logger LOG = LoggerFactory.getLogger(ConversionService.class);

    private final ReadScope readScope;
    private final AiConversionClient ai;

    public ConversionService() {
        this(ReadScope.NONE, AiConversionClient.DISABLED);
    }

    public ConversionService(ReadScope readScope, AiConversionClient ai) {
        this.readScope = readScope == null ? ReadScope.NONE : readScope;
        this.ai = ai == null ? AiConversionClient.DISABLED : ai;
    }

    /** Convert every unit sequentially on the calling thread. */
    public ConversionResult convert(SourceProject project, ConversionOptions options) {
        return convert(project, options, null);
    }

    /**
     * Convert every unit, on {@code executor} when given. Outputs always follow the
     * conversion order, whatever order the units finish in.
     */
    public ConversionResult convert(SourceProject project, ConversionOptions options, ExecutorService executor) {
        if (project == null) throw new IllegalArgumentException("project must not be null");
        if (options == null) options = new ConversionOptions();

        SymbolIndex index = SymbolIndex.build(project);
        DependencyGraph graph = new DependencyGraphBuilder().build(index);
        ConversionPlan plan = new ConversionScheduler(options.complexityThreshold).plan(index, graph);
        LOG.info("Converting {} unit(s) of {} ({} dependency edge(s), {} cycle(s))",
                plan.order.size(), project.name, graph.edgeCount(), plan.cycles.size());

        Shared shared = new Shared(
                TargetLayout.of(project),
                unitsByPath(project),
                projectSymbols(index),
                componentParameters(project),
                options.toGeneratorOptions(),
                options.aiEnabled,
                options.stateManagement,
                options.navigation,
                graph);

        List<UnitJob> jobs = new ArrayList<>();
        for (ConversionTask task : plan.tasks) {
            jobs.add(new UnitJob(task, shared.units.get(task.unitPath), shared));
        }
        List<UnitOutcome> outcomes = executor == null ? runSequentially(jobs) : runOn(executor, jobs);

        GenerationWarnings warnings = new GenerationWarnings();
        for (List<String> cycle : plan.cycles) {
            warnings.warn(GenerationWarnings.CYCLE, "Dependency cycle: " + String.join(" -> ", cycle),
                    "units", String.join(", ", cycle));
        }

        List<UnitOutput> outputs = new ArrayList<>();
        Map<String, List<UiTree>> trees = new LinkedHashMap<>();
        List<ConversionError> errors = new ArrayList<>();
        for (UnitOutcome o : outcomes) {
            warnings.addAll(o.warnings);
            if (o.error != null) {
                errors.add(o.error);
                continue;
            }
            outputs.add(o.output);
            if (!o.trees.isEmpty()) trees.put(o.output.unitPath, o.trees);
        }

        ConversionReport report = new ConversionReport(
                project.name,
                stats(plan, outputs, errors, warnings),
                plan.order,
                plan.cycles,
                plan.complexity,
                summaries(outputs),
                errors,
                warnings.toDeterministicList());
        LOG.info("Converted {} of {} unit(s), {} error(s), {} warning(s)",
                outputs.size(), plan.order.size(), errors.size(), warnings.size());
        return new ConversionResult(outputs, trees, plan, report);
    }

    private List<UnitOutcome> runSequentially(List<UnitJob> jobs) {
        List<UnitOutcome> out = new ArrayList<>();
        for (UnitJob job : jobs) out.add(job.call());
        return out;
    }

    private List<UnitOutcome> runOn(ExecutorService executor, List<UnitJob> jobs) {
        List<Future<UnitOutcome>> futures = new ArrayList<>();
        for (UnitJob job : jobs) futures.add(executor.submit(job));
        List<UnitOutcome> out = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String path = jobs.get(i).task.unitPath;
            try {
                out.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while converting " + path, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.warn("Conversion of {} failed: {}", path, cause.toString());
                out.add(UnitOutcome.failed(path, describe(cause), new GenerationWarnings()));
            }
        }
        return out;
    }

    private static Map<String, SourceUnit> unitsByPath(SourceProject project) {
        Map<String, SourceUnit> out = new LinkedHashMap<>();
        for (SourceUnit u : project.units) out.put(u.path, u);
        return out;
    }

    /** Declared parameter names of every composable function, first declaration wins. */
    static Map<String, List<String>> componentParameters(SourceProject project) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (SourceUnit u : project.units) {
            for (SourceDeclaration d : u.declarations) {
                if (!d.isComposable() || out.containsKey(d.name)) continue;
                List<String> names = new ArrayList<>();
                for (SourceParameter p : d.parameters) names.add(p.name);
                out.put(d.name, names);
            }
        }
        return out;
    }

    /** Every class (simple and nested path) and function name defined in the project. */
    static Set<String> projectSymbols(SymbolIndex index) {
        Set<String> out = new LinkedHashSet<>();
        for (UnitSymbols u : index.units()) {
            for (String cls : u.definedClasses) {
                out.add(cls);
                int dot = cls.lastIndexOf('.');
                if (dot >= 0) out.add(cls.substring(dot + 1));
            }
            out.addAll(u.definedFunctions);
        }
        return out;
    }

    private ConversionReport.Stats stats(ConversionPlan plan, List<UnitOutput> outputs, List<ConversionError> errors,
                                         GenerationWarnings warnings) {
        int ai = 0;
        int components = 0;
        int sourceLines = 0;
        int generatedLines = 0;
        for (UnitOutput o : outputs) {
            if (o.generationMethod == GenerationMethod.AI_ASSISTED) ai++;
            components += o.components.size();
            sourceLines += o.sourceLineCount;
            generatedLines += o.generatedLineCount;
        }
        return new ConversionReport.Stats(plan.order.size(), outputs.size(), errors.size(), ai, components,
                sourceLines, generatedLines, warnings.size());
    }

    private static List<ConversionReport.UnitSummary> summaries(List<UnitOutput> outputs) {
        List<ConversionReport.UnitSummary> out = new ArrayList<>();
        for (UnitOutput o : outputs) out.add(new ConversionReport.UnitSummary(o));
        return out;
    }

    static String describe(Throwable t) {
        String m = t.getMessage();
        return t.getClass().getSimpleName() + (m == null || m.isBlank() ? "" : ": " + m);
    }

    /** Analysis and generation of one unit. Never throws for a failing unit. */
    private final class UnitJob implements Callable<UnitOutcome> {

        final ConversionTask task;
        final SourceUnit unit;
        final Shared shared;

        UnitJob(ConversionTask task, SourceUnit unit, Shared shared) {
            this.task = task;
            this.unit = unit;
            this.shared = shared;
        }

        @Override
        public UnitOutcome call() {
            String path = task.unitPath;
            GenerationWarnings warnings = new GenerationWarnings();
            try {
                if (unit == null) throw new IllegalStateException("unit not found in project");
                String targetPath = shared.layout.targetPath(unit);

                List<UiTree> trees;
                GeneratedUnit generated;
                readScope.acquire(path);
                try {
                    trees = new UiTreeExtractor().extractUnit(unit);
                    GenerationContext ctx = new GenerationContext(path, shared.symbols, shared.componentParameters,
                            shared.generatorOptions, warnings);
                    generated = new UnitGenerator().generate(unit, trees, dependencyImports(targetPath), ctx);
                } finally {
                    readScope.release(path);
                }

                String code = generated.code;
                GenerationMethod method = GenerationMethod.RULE_BASED;
                if (task.requiresAi && shared.aiEnabled) {
                    String aiCode = tryAi(targetPath, code, warnings);
                    if (aiCode != null) {
                        code = aiCode;
                        method = GenerationMethod.AI_ASSISTED;
                    }
                }

                List<String> componentNames = new ArrayList<>();
                for (GeneratedComponent c : generated.components) componentNames.add(c.name);
                UnitOutput output = new UnitOutput(path, targetPath, task.priority, task.complexity, generated.shape,
                        method, componentNames, generated.imports, unit.lineCount(), code);
                LOG.debug("Converted {}", output);
                return UnitOutcome.converted(output, trees, warnings);
            } catch (RuntimeException ex) {
                LOG.warn("Conversion of {} failed: {}", path, ex.toString());
                LOG.debug("Conversion failure detail for {}", path, ex);
                return UnitOutcome.failed(path, describe(ex), warnings);
            }
        }

        private List<String> dependencyImports(String targetPath) {
            TreeSet<String> out = new TreeSet<>();
            for (String dep : shared.graph.dependenciesOf(task.unitPath)) {
                SourceUnit depUnit = shared.units.get(dep);
                if (depUnit == null) continue;
                out.add(TargetLayout.relativeImport(targetPath, shared.layout.targetPath(depUnit)));
            }
            return new ArrayList<>(out);
        }

        /** AI output, or null when the rule-based output stays. */
        private String tryAi(String targetPath, String ruleBased, GenerationWarnings warnings) {
            String path = task.unitPath;
            if (!ai.isAvailable()) {
                LOG.info("AI conversion unavailable, keeping rule-based output for {}", path);
                return null;
            }
            String failure;
            try {
                AiConversionResult r = ai.convert(new AiConversionRequest(path, targetPath, unit.text, ruleBased, task.complexity,
                        shared.stateManagement, shared.navigation));
                if (r != null && r.success) {
                    LOG.info("AI conversion used for {}", path);
                    return r.code;
                }
                failure = r == null ? "no result" : r.error;
            } catch (IOException | RuntimeException ex) {
                failure = describe(ex);
            }
            LOG.warn("AI conversion of {} failed, keeping rule-based output: {}", path, failure);
            warnings.warn(GenerationWarnings.AI_FALLBACK, "AI conversion failed, rule-based output kept: " + failure,
                    "unit", path);
            return null;
        }
    }

    /** Inputs shared by all units of one run; read-only. */
    private static final class Shared {
        final TargetLayout layout;
        final Map<String, SourceUnit> units;
        final Set<String> symbols;
        final Map<String, List<String>> componentParameters;
        final GeneratorOptions generatorOptions;
        final boolean aiEnabled;
        final String stateManagement;
        final String navigation;
        final DependencyGraph graph;

        Shared(TargetLayout layout, Map<String, SourceUnit> units, Set<String> symbols,
               Map<String, List<String>> componentParameters, GeneratorOptions generatorOptions,
               boolean aiEnabled, String stateManagement, String navigation, DependencyGraph graph) {
            this.layout = layout;
            this.units = units;
            this.symbols = symbols;
            this.componentParameters = componentParameters;
            this.generatorOptions = generatorOptions;
            this.aiEnabled = aiEnabled;
            this.stateManagement = stateManagement;
            this.navigation = navigation;
            this.graph = graph;
        }
    }

    /** Result of one {@link UnitJob}: an output or an error, plus the unit's warnings. */
    static final class UnitOutcome {
        final UnitOutput output;
        final List<UiTree> trees;
        final ConversionError error;
        final GenerationWarnings warnings;

        private UnitOutcome(UnitOutput output, List<UiTree> trees, ConversionError error, GenerationWarnings warnings) {
            this.output = output;
            this.trees = trees == null ? List.of() : List.copyOf(trees);
            this.error = error;
            this.warnings = warnings;
        }

        static UnitOutcome converted(UnitOutput output, List<UiTree> trees, GenerationWarnings warnings) {
            return new UnitOutcome(output, trees, null, warnings);
        }

        static UnitOutcome failed(String unitPath, String message, GenerationWarnings warnings) {
            return new UnitOutcome(null, null,
                    new ConversionError(ConversionError.CONVERSION_ERROR, message, unitPath), warnings);
        }
    }
}
