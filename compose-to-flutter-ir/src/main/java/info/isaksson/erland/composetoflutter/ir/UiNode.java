package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural UI tree node extracted from a component body.
 *
 * <p>Consumers dispatch with {@link Visitor} so that adding a node kind breaks every renderer
 * at compile time.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = UiNode.Widget.class, name = "widget"),
        @JsonSubTypes.Type(value = UiNode.Conditional.class, name = "conditional"),
        @JsonSubTypes.Type(value = UiNode.MultiBranch.class, name = "multiBranch"),
        @JsonSubTypes.Type(value = UiNode.Iteration.class, name = "iteration")
})
public sealed interface UiNode permits UiNode.Widget, UiNode.Conditional, UiNode.MultiBranch, UiNode.Iteration {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitWidget(Widget widget);

        R visitConditional(Conditional conditional);

        R visitMultiBranch(MultiBranch multiBranch);

        R visitIteration(Iteration iteration);
    }

    /** A source-side component invocation, e.g. {@code Text("Hi", modifier = Modifier.padding(8.dp))}. */
    @JsonPropertyOrder({"name","arguments","modifiers","children"})
    final class Widget implements UiNode {
        public final String name;
        /** Insertion-ordered; positional arguments are keyed {@code arg0}, {@code arg1}, ... */
        public final Map<String, ArgumentValue> arguments;
        /** Style directives in extraction (chain-walk) order. */
        public final List<ModifierDirective> modifiers;
        public final List<UiNode> children;

        public Widget(String name, Map<String, ArgumentValue> arguments, List<ModifierDirective> modifiers, List<UiNode> children) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.arguments = arguments == null || arguments.isEmpty()
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
            this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
            this.children = children == null ? List.of() : List.copyOf(children);
        }

        public static Widget leaf(String name) {
            return new Widget(name, null, null, null);
        }

        public ArgumentValue argument(String key) {
            return arguments.get(key);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWidget(this);
        }
    }

    /** Two-way branch. Either branch may be empty, never both. */
    @JsonPropertyOrder({"condition","thenBranch","elseBranch"})
    final class Conditional implements UiNode {
        public final String condition;
        public final List<UiNode> thenBranch;
        public final List<UiNode> elseBranch;

        public Conditional(String condition, List<UiNode> thenBranch, List<UiNode> elseBranch) {
            this.condition = Objects.requireNonNull(condition, "condition must not be null");
            this.thenBranch = thenBranch == null ? List.of() : List.copyOf(thenBranch);
            this.elseBranch = elseBranch == null ? List.of() : List.copyOf(elseBranch);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    @JsonPropertyOrder({"condition","isElse","nodes"})
    final class Branch {
        public static final String ELSE_CONDITION = "true";

        /** Raw condition text; several source conditions are kept comma separated. */
        public final String condition;
        public final boolean isElse;
        public final List<UiNode> nodes;

        public Branch(String condition, boolean isElse, List<UiNode> nodes) {
            this.condition = isElse ? ELSE_CONDITION : Objects.requireNonNull(condition, "condition must not be null");
            this.isElse = isElse;
            this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        }
    }

    /** Ordered multi-way dispatch with an optional subject. */
    @JsonPropertyOrder({"subject","branches"})
    final class MultiBranch implements UiNode {
        public final String subject;
        public final List<Branch> branches;

        public MultiBranch(String subject, List<Branch> branches) {
            this.subject = subject;
            this.branches = branches == null ? List.of() : List.copyOf(branches);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMultiBranch(this);
        }
    }

    @JsonPropertyOrder({"variable","source","children"})
    final class Iteration implements UiNode {
        public static final String DEFAULT_VARIABLE = "it";

        public final String variable;
        public final String source;
        public final List<UiNode> children;

        public Iteration(String variable, String source, List<UiNode> children) {
            this.variable = variable == null || variable.isBlank() ? DEFAULT_VARIABLE : variable;
            this.source = Objects.requireNonNull(source, "source must not be null");
            this.children = children == null ? List.of() : List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIteration(this);
        }
    }
}
