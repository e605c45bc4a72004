package info.isaksson.erland.composetoflutter.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.composetoflutter.emitter.ComponentShape;
import info.isaksson.erland.composetoflutter.graph.ConversionPriority;

import java.util.List;
import java.util.Objects;

/** The generated target file for one source unit. */
@JsonPropertyOrder({"unitPath","targetPath","targetFileName","priority","complexity","shape","generationMethod",
        "components","imports","sourceLineCount","generatedLineCount","code"})
public final class UnitOutput {
    public final String unitPath;

    /** Path relative to the output root, e.g. {@code ui/notes_screen.dart}. */
    public final String targetPath;

    /** Last segment of {@link #targetPath}. */
    public final String targetFileName;

    public final ConversionPriority priority;
    public final int complexity;
    public final ComponentShape shape;
    public final GenerationMethod generationMethod;

    /** Names of the components rendered into this file, in source order. */
    public final List<String> components;

    public final List<String> imports;
    public final int sourceLineCount;
    public final int generatedLineCount;
    public final String code;

    public UnitOutput(
            String unitPath,
            String targetPath,
            ConversionPriority priority,
            int complexity,
            ComponentShape shape,
            GenerationMethod generationMethod,
            List<String> components,
            List<String> imports,
            int sourceLineCount,
            String code
    ) {
        this.unitPath = Objects.requireNonNull(unitPath, "unitPath must not be null");
        this.targetPath = Objects.requireNonNull(targetPath, "targetPath must not be null");
        int slash = targetPath.lastIndexOf('/');
        this.targetFileName = slash >= 0 ? targetPath.substring(slash + 1) : targetPath;
        this.priority = priority;
        this.complexity = complexity;
        this.shape = shape == null ? ComponentShape.NONE : shape;
        this.generationMethod = generationMethod == null ? GenerationMethod.RULE_BASED : generationMethod;
        this.components = components == null ? List.of() : List.copyOf(components);
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.sourceLineCount = sourceLineCount;
        this.code = code == null ? "" : code;
        this.generatedLineCount = this.code.isEmpty() ? 0 : (int) this.code.lines().count();
    }

    @Override
    public String toString() {
        return unitPath + " -> " + targetPath + " (" + generationMethod + ", " + shape + ")";
    }
}
