package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** The extracted UI of one component function. */
@JsonPropertyOrder({"name","parameters","state","roots"})
public final class UiTree {
    public final String name;
    public final List<SourceParameter> parameters;
    public final List<StateVariable> state;
    public final List<UiNode> roots;

    public UiTree(String name, List<SourceParameter> parameters, List<StateVariable> state, List<UiNode> roots) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.state = state == null ? List.of() : List.copyOf(state);
        this.roots = roots == null ? List.of() : List.copyOf(roots);
    }

    @JsonIgnore
    public boolean isStateful() {
        return !state.isEmpty();
    }

    public StateVariable stateVariable(String name) {
        for (StateVariable v : state) {
            if (v.name.equals(name)) return v;
        }
        return null;
    }
}
