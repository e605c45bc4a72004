package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/** Classified widget argument value. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ArgumentValue.StringValue.class, name = "string"),
        @JsonSubTypes.Type(value = ArgumentValue.IntValue.class, name = "int"),
        @JsonSubTypes.Type(value = ArgumentValue.DoubleValue.class, name = "double"),
        @JsonSubTypes.Type(value = ArgumentValue.BoolValue.class, name = "bool"),
        @JsonSubTypes.Type(value = ArgumentValue.Reference.class, name = "reference"),
        @JsonSubTypes.Type(value = ArgumentValue.CallValue.class, name = "call"),
        @JsonSubTypes.Type(value = ArgumentValue.Closure.class, name = "closure"),
        @JsonSubTypes.Type(value = ArgumentValue.Raw.class, name = "raw"),
        @JsonSubTypes.Type(value = ArgumentValue.NullValue.class, name = "null")
})
public sealed interface ArgumentValue {

    /** Source text of the value as written. */
    String text();

    final class StringValue implements ArgumentValue {
        public final String value;

        public StringValue(String value) {
            this.value = value == null ? "" : value;
        }

        @Override
        public String text() {
            return "\"" + value + "\"";
        }
    }

    final class IntValue implements ArgumentValue {
        public final long value;

        public IntValue(long value) {
            this.value = value;
        }

        @Override
        public String text() {
            return Long.toString(value);
        }
    }

    final class DoubleValue implements ArgumentValue {
        public final double value;

        public DoubleValue(double value) {
            this.value = value;
        }

        @Override
        public String text() {
            return Double.toString(value);
        }
    }

    final class BoolValue implements ArgumentValue {
        public final boolean value;

        public BoolValue(boolean value) {
            this.value = value;
        }

        @Override
        public String text() {
            return Boolean.toString(value);
        }
    }

    /** Name or dotted path, e.g. {@code title} or {@code Color.Red}. */
    final class Reference implements ArgumentValue {
        public final String name;

        public Reference(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String text() {
            return name;
        }
    }

    /** Nested non-widget call, e.g. {@code RoundedCornerShape(8.dp)}. */
    @JsonPropertyOrder({"name","arguments","source"})
    final class CallValue implements ArgumentValue {
        public final String name;
        /** Raw argument texts, {@code name = value} for named ones. */
        public final List<String> arguments;
        public final String source;

        public CallValue(String name, List<String> arguments, String source) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
            this.source = source == null ? name + "(" + String.join(", ", this.arguments) + ")" : source;
        }

        @Override
        public String text() {
            return source;
        }
    }

    /** Inline function value. {@code nodes} holds UI nodes found in its body (slot content). */
    @JsonPropertyOrder({"source","parameters","statements","nodes"})
    final class Closure implements ArgumentValue {
        public final String source;
        public final List<String> parameters;
        public final List<String> statements;
        public final List<UiNode> nodes;

        public Closure(String source, List<String> parameters, List<String> statements, List<UiNode> nodes) {
            this.source = source == null ? "" : source;
            this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
            this.statements = statements == null ? List.of() : List.copyOf(statements);
            this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        }

        @Override
        public String text() {
            return source;
        }
    }

    final class Raw implements ArgumentValue {
        public final String source;

        public Raw(String source) {
            this.source = source == null ? "" : source;
        }

        @Override
        public String text() {
            return source;
        }
    }

    final class NullValue implements ArgumentValue {
        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override
        public String text() {
            return "null";
        }
    }
}
