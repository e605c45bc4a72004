package info.isaksson.erland.composetoflutter.emitter;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"name","shape","code"})
public final class GeneratedComponent {
    public final String name;
    public final ComponentShape shape;
    public final String code;

    public GeneratedComponent(String name, ComponentShape shape, String code) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.shape = Objects.requireNonNull(shape, "shape must not be null");
        this.code = code == null ? "" : code;
    }

    @Override
    public String toString() {
        return "GeneratedComponent{" + name + ", " + shape + "}";
    }
}
