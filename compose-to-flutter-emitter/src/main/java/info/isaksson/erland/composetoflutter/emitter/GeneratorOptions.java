package info.isaksson.erland.composetoflutter.emitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Options for generating target source from extracted trees and declarations. */
public final class GeneratorOptions {

    /** Source widget name to target widget name; replaces built-in rendering for that widget. */
    public final Map<String, String> widgetMappings;

    /** Source type name to target type text; consulted before the built-in tables. */
    public final Map<String, String> typeMappings;

    /** Emit {@code const} for argument-free constructors known to be constant. */
    public final boolean constConstructors;

    /** Emit a header comment naming the source unit. */
    public final boolean sourceComments;

    public GeneratorOptions(
            Map<String, String> widgetMappings,
            Map<String, String> typeMappings,
            boolean constConstructors,
            boolean sourceComments
    ) {
        this.widgetMappings = copy(widgetMappings);
        this.typeMappings = copy(typeMappings);
        this.constConstructors = constConstructors;
        this.sourceComments = sourceComments;
    }

    public static GeneratorOptions defaults() {
        return new GeneratorOptions(null, null, true, true);
    }

    public GeneratorOptions withWidgetMappings(Map<String, String> mappings) {
        return new GeneratorOptions(mappings, typeMappings, constConstructors, sourceComments);
    }

    public GeneratorOptions withTypeMappings(Map<String, String> mappings) {
        return new GeneratorOptions(widgetMappings, mappings, constConstructors, sourceComments);
    }

    public GeneratorOptions withSourceComments(boolean include) {
        return new GeneratorOptions(widgetMappings, typeMappings, constConstructors, include);
    }

    private static Map<String, String> copy(Map<String, String> m) {
        return m == null || m.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    @Override
    public String toString() {
        return "GeneratorOptions{" +
                "widgetMappings=" + widgetMappings +
                ", typeMappings=" + typeMappings +
                ", constConstructors=" + constConstructors +
                ", sourceComments=" + sourceComments +
                '}';
    }
}
