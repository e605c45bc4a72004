package info.isaksson.erland.composetoflutter.emitter;

import info.isaksson.erland.composetoflutter.mapping.TypeMapper;
import info.isaksson.erland.composetoflutter.mapping.WidgetMappings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Per-unit generation state: the project's symbol names and component signatures, mapping
 * tables, the warning collector and the extra imports requested while rendering.
 *
 * <p>One context serves one unit and is not shared between threads.</p>
 */
public final class GenerationContext {

    public static final String MATERIAL_IMPORT = "package:flutter/material.dart";
    public static final String NETWORK_IMAGE_IMPORT = "package:cached_network_image/cached_network_image.dart";
    public static final String MATH_IMPORT = "dart:math";

    private static final Pattern FLUTTER_TYPES = Pattern.compile(
            "\\b(?:Widget|BuildContext|Color|Offset|Size|Rect|EdgeInsets|ShapeBorder|ImageProvider|IconData|TextStyle|FontWeight|ValueNotifier)\\b");

    public final String unitPath;
    public final GeneratorOptions options;
    public final TypeMapper types;
    public final WidgetMappings widgets;

    private final Set<String> projectSymbols;
    private final Map<String, List<String>> componentParameters;
    private final GenerationWarnings warnings;
    private final SortedSet<String> imports = new TreeSet<>();

    public GenerationContext(String unitPath, Set<String> projectSymbols, GeneratorOptions options, GenerationWarnings warnings) {
        this(unitPath, projectSymbols, null, options, warnings);
    }

    /**
     * @param componentParameters declared parameter names of each project component, in
     *                            declaration order; used to name positional call arguments
     */
    public GenerationContext(String unitPath, Set<String> projectSymbols, Map<String, List<String>> componentParameters,
                             GeneratorOptions options, GenerationWarnings warnings) {
        this.unitPath = Objects.requireNonNull(unitPath, "unitPath must not be null");
        this.projectSymbols = projectSymbols == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(projectSymbols));
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (componentParameters != null) {
            for (Map.Entry<String, List<String>> e : componentParameters.entrySet()) {
                params.put(e.getKey(), List.copyOf(e.getValue()));
            }
        }
        this.componentParameters = Collections.unmodifiableMap(params);
        this.options = options == null ? GeneratorOptions.defaults() : options;
        this.warnings = warnings == null ? new GenerationWarnings() : warnings;
        this.types = new TypeMapper(this.options.typeMappings);
        this.widgets = new WidgetMappings(this.options.widgetMappings);
    }

    public boolean isProjectSymbol(String simpleName) {
        return projectSymbols.contains(simpleName);
    }

    /** Parameter names of a project component, or null when its signature is unknown. */
    public List<String> componentParameters(String component) {
        return componentParameters.get(component);
    }

    public Set<String> projectSymbols() {
        return projectSymbols;
    }

    public GenerationWarnings warnings() {
        return warnings;
    }

    public void requireImport(String uri) {
        if (uri != null && !uri.isBlank()) imports.add(uri);
    }

    public SortedSet<String> requiredImports() {
        return Collections.unmodifiableSortedSet(imports);
    }

    /** Maps a source type, reporting names no table or project symbol covers. */
    public String mapType(String sourceType, String owner) {
        for (String name : types.unmappedNames(sourceType, projectSymbols)) {
            warn(GenerationWarnings.UNMAPPED_TYPE, "Type kept as-is: " + name, owner);
        }
        String mapped = types.map(sourceType);
        if (FLUTTER_TYPES.matcher(mapped).find()) requireImport(MATERIAL_IMPORT);
        return mapped;
    }

    public void warn(String code, String message, String name) {
        if (name == null) {
            warnings.warn(code, message, "unit", unitPath);
        } else {
            warnings.warn(code, message, "unit", unitPath, "name", name);
        }
    }
}
