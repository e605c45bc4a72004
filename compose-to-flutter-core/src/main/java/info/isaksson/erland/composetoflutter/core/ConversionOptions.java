package info.isaksson.erland.composetoflutter.core;

import info.isaksson.erland.composetoflutter.emitter.GeneratorOptions;
import info.isaksson.erland.composetoflutter.graph.ConversionScheduler;
import info.isaksson.erland.composetoflutter.ir.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Core (server-friendly) options for a project conversion.
 *
 * <p>Mirrors the CLI flags in a structured form. The same fields can be loaded from a JSON
 * options file; unknown keys are ignored.</p>
 */
public final class ConversionOptions {

    /** Units whose complexity score exceeds this value are flagged for AI-assisted conversion. */
    public int complexityThreshold = ConversionScheduler.DEFAULT_COMPLEXITY_THRESHOLD;

    /** Whether flagged units are offered to the {@link AiConversionClient}. */
    public boolean aiEnabled = false;

    public static final String DEFAULT_STATE_MANAGEMENT = "riverpod";
    public static final String DEFAULT_NAVIGATION = "go_router";

    /** Target-ecosystem conventions passed along with every AI conversion request. */
    public String stateManagement = DEFAULT_STATE_MANAGEMENT;
    public String navigation = DEFAULT_NAVIGATION;

    /** Source widget name to target widget name. */
    public Map<String, String> widgetMappings = new LinkedHashMap<>();

    /** Source type name to target type text. */
    public Map<String, String> typeMappings = new LinkedHashMap<>();

    public boolean constConstructors = true;

    /** Emit a {@code // Converted from ...} header in every generated file. */
    public boolean sourceComments = true;

    public GeneratorOptions toGeneratorOptions() {
        return new GeneratorOptions(widgetMappings, typeMappings, constConstructors, sourceComments);
    }

    /** Load options from a JSON file; absent keys keep their defaults. */
    public static ConversionOptions read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        try (var in = Files.newInputStream(path)) {
            ConversionOptions o = JsonSupport.mapper().readValue(in, ConversionOptions.class);
            return o == null ? new ConversionOptions() : o;
        }
    }
}
