package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Reactive state captured from a component body. */
@JsonPropertyOrder({"name","type","flavor","initializer","initialValue"})
public final class StateVariable {
    /** Type used when neither an annotation nor the initial value gives one. */
    public static final String UNTYPED = "Any";

    public final String name;
    /** Source-side type, declared or inferred. */
    public final String type;
    public final StateFlavor flavor;
    public final String initializer;
    /** Argument of the state constructor, e.g. {@code 0} for {@code mutableStateOf(0)}; may be null. */
    public final String initialValue;

    public StateVariable(String name, String type, StateFlavor flavor, String initializer, String initialValue) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = type == null || type.isBlank() ? UNTYPED : type;
        this.flavor = flavor == null ? StateFlavor.PLAIN : flavor;
        this.initializer = initializer == null ? "" : initializer;
        this.initialValue = initialValue;
    }
}
