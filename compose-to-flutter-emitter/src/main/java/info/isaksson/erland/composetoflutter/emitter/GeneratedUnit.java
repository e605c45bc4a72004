package info.isaksson.erland.composetoflutter.emitter;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Target source for one unit. */
@JsonPropertyOrder({"imports","shape","components","code"})
public final class GeneratedUnit {
    public final List<String> imports;
    public final ComponentShape shape;
    public final List<GeneratedComponent> components;
    public final String code;

    public GeneratedUnit(List<String> imports, ComponentShape shape, List<GeneratedComponent> components, String code) {
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.shape = shape == null ? ComponentShape.NONE : shape;
        this.components = components == null ? List.of() : List.copyOf(components);
        this.code = code == null ? "" : code;
    }

    public int lineCount() {
        return code.isEmpty() ? 0 : (int) code.lines().count();
    }
}
