package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Expression-level syntax tree delivered by the front-end for function bodies.
 *
 * <p>The tree is intentionally shallow: only the node kinds the UI extractor and the
 * complexity calculator look at are structural. Everything else arrives as {@link Other}.
 * Every node keeps its raw source text.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SourceExpr.Block.class, name = "block"),
        @JsonSubTypes.Type(value = SourceExpr.Call.class, name = "call"),
        @JsonSubTypes.Type(value = SourceExpr.Qualified.class, name = "qualified"),
        @JsonSubTypes.Type(value = SourceExpr.If.class, name = "if"),
        @JsonSubTypes.Type(value = SourceExpr.When.class, name = "when"),
        @JsonSubTypes.Type(value = SourceExpr.For.class, name = "for"),
        @JsonSubTypes.Type(value = SourceExpr.While.class, name = "while"),
        @JsonSubTypes.Type(value = SourceExpr.Try.class, name = "try"),
        @JsonSubTypes.Type(value = SourceExpr.Lambda.class, name = "lambda"),
        @JsonSubTypes.Type(value = SourceExpr.Binding.class, name = "binding"),
        @JsonSubTypes.Type(value = SourceExpr.StringLiteral.class, name = "string"),
        @JsonSubTypes.Type(value = SourceExpr.Constant.class, name = "constant"),
        @JsonSubTypes.Type(value = SourceExpr.NameRef.class, name = "name"),
        @JsonSubTypes.Type(value = SourceExpr.Other.class, name = "other")
})
public abstract sealed class SourceExpr {

    public final String text;

    protected SourceExpr(String text) {
        this.text = text == null ? "" : text;
    }

    @JsonPropertyOrder({"text","statements"})
    public static final class Block extends SourceExpr {
        public final List<SourceExpr> statements;

        @JsonCreator
        public Block(@JsonProperty("text") String text,
                     @JsonProperty("statements") List<SourceExpr> statements) {
            super(text);
            this.statements = statements == null ? List.of() : List.copyOf(statements);
        }

        public static Block of(SourceExpr... statements) {
            StringBuilder sb = new StringBuilder();
            for (SourceExpr s : statements) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(s.text);
            }
            return new Block(sb.toString(), List.of(statements));
        }
    }

    /** A value argument of a call; {@code name} is null for positional arguments. */
    @JsonPropertyOrder({"name","value"})
    public static final class Argument {
        public final String name;
        public final SourceExpr value;

        @JsonCreator
        public Argument(@JsonProperty("name") String name,
                        @JsonProperty("value") SourceExpr value) {
            this.name = name;
            this.value = Objects.requireNonNull(value, "value must not be null");
        }

        public static Argument positional(SourceExpr value) {
            return new Argument(null, value);
        }

        public static Argument named(String name, SourceExpr value) {
            return new Argument(name, value);
        }
    }

    @JsonPropertyOrder({"text","callee","arguments","trailingLambdas"})
    public static final class Call extends SourceExpr {
        public final String callee;
        public final List<Argument> arguments;
        public final List<Lambda> trailingLambdas;

        @JsonCreator
        public Call(@JsonProperty("text") String text,
                    @JsonProperty("callee") String callee,
                    @JsonProperty("arguments") List<Argument> arguments,
                    @JsonProperty("trailingLambdas") List<Lambda> trailingLambdas) {
            super(text);
            this.callee = Objects.requireNonNull(callee, "callee must not be null");
            this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
            this.trailingLambdas = trailingLambdas == null ? List.of() : List.copyOf(trailingLambdas);
        }

        /** Named argument value, or null. */
        public SourceExpr argument(String name) {
            for (Argument a : arguments) {
                if (name.equals(a.name)) return a.value;
            }
            return null;
        }
    }

    /** {@code receiver.selector} or {@code receiver?.selector}. */
    @JsonPropertyOrder({"text","receiver","selector","safe"})
    public static final class Qualified extends SourceExpr {
        public final SourceExpr receiver;
        public final SourceExpr selector;
        public final boolean safe;

        @JsonCreator
        public Qualified(@JsonProperty("text") String text,
                         @JsonProperty("receiver") SourceExpr receiver,
                         @JsonProperty("selector") SourceExpr selector,
                         @JsonProperty("safe") boolean safe) {
            super(text);
            this.receiver = Objects.requireNonNull(receiver, "receiver must not be null");
            this.selector = Objects.requireNonNull(selector, "selector must not be null");
            this.safe = safe;
        }
    }

    @JsonPropertyOrder({"text","condition","thenBranch","elseBranch"})
    public static final class If extends SourceExpr {
        public final String condition;
        public final SourceExpr thenBranch;
        public final SourceExpr elseBranch;

        @JsonCreator
        public If(@JsonProperty("text") String text,
                  @JsonProperty("condition") String condition,
                  @JsonProperty("thenBranch") SourceExpr thenBranch,
                  @JsonProperty("elseBranch") SourceExpr elseBranch) {
            super(text);
            this.condition = condition == null ? "" : condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
    }

    @JsonPropertyOrder({"conditions","isElse","body"})
    public static final class WhenEntry {
        public final List<String> conditions;
        public final boolean isElse;
        public final SourceExpr body;

        @JsonCreator
        public WhenEntry(@JsonProperty("conditions") List<String> conditions,
                         @JsonProperty("isElse") boolean isElse,
                         @JsonProperty("body") SourceExpr body) {
            this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
            this.isElse = isElse;
            this.body = body;
        }
    }

    @JsonPropertyOrder({"text","subject","entries"})
    public static final class When extends SourceExpr {
        /** Subject expression text, null for subject-less dispatch. */
        public final String subject;
        public final List<WhenEntry> entries;

        @JsonCreator
        public When(@JsonProperty("text") String text,
                    @JsonProperty("subject") String subject,
                    @JsonProperty("entries") List<WhenEntry> entries) {
            super(text);
            this.subject = subject;
            this.entries = entries == null ? List.of() : List.copyOf(entries);
        }
    }

    @JsonPropertyOrder({"text","variable","range","body"})
    public static final class For extends SourceExpr {
        public final String variable;
        public final String range;
        public final SourceExpr body;

        @JsonCreator
        public For(@JsonProperty("text") String text,
                   @JsonProperty("variable") String variable,
                   @JsonProperty("range") String range,
                   @JsonProperty("body") SourceExpr body) {
            super(text);
            this.variable = variable;
            this.range = range == null ? "" : range;
            this.body = body;
        }
    }

    @JsonPropertyOrder({"text","condition","body","doWhile"})
    public static final class While extends SourceExpr {
        public final String condition;
        public final SourceExpr body;
        public final boolean doWhile;

        @JsonCreator
        public While(@JsonProperty("text") String text,
                     @JsonProperty("condition") String condition,
                     @JsonProperty("body") SourceExpr body,
                     @JsonProperty("doWhile") boolean doWhile) {
            super(text);
            this.condition = condition == null ? "" : condition;
            this.body = body;
            this.doWhile = doWhile;
        }
    }

    @JsonPropertyOrder({"text","body","catchCount","hasFinally"})
    public static final class Try extends SourceExpr {
        public final SourceExpr body;
        public final int catchCount;
        public final boolean hasFinally;

        @JsonCreator
        public Try(@JsonProperty("text") String text,
                   @JsonProperty("body") SourceExpr body,
                   @JsonProperty("catchCount") int catchCount,
                   @JsonProperty("hasFinally") boolean hasFinally) {
            super(text);
            this.body = body;
            this.catchCount = Math.max(0, catchCount);
            this.hasFinally = hasFinally;
        }
    }

    @JsonPropertyOrder({"text","parameters","body"})
    public static final class Lambda extends SourceExpr {
        public final List<String> parameters;
        public final Block body;

        @JsonCreator
        public Lambda(@JsonProperty("text") String text,
                      @JsonProperty("parameters") List<String> parameters,
                      @JsonProperty("body") Block body) {
            super(text);
            this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
            this.body = body == null ? new Block("", List.of()) : body;
        }

        public static Lambda of(SourceExpr... statements) {
            Block b = Block.of(statements);
            return new Lambda("{ " + b.text + " }", List.of(), b);
        }
    }

    /** Local {@code val}/{@code var} declaration, optionally delegated with {@code by}. */
    @JsonPropertyOrder({"text","name","type","mutable","delegated","initializer"})
    public static final class Binding extends SourceExpr {
        public final String name;
        public final String type;
        public final boolean mutable;
        public final boolean delegated;
        public final SourceExpr initializer;

        @JsonCreator
        public Binding(@JsonProperty("text") String text,
                       @JsonProperty("name") String name,
                       @JsonProperty("type") String type,
                       @JsonProperty("mutable") boolean mutable,
                       @JsonProperty("delegated") boolean delegated,
                       @JsonProperty("initializer") SourceExpr initializer) {
            super(text);
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.type = type;
            this.mutable = mutable;
            this.delegated = delegated;
            this.initializer = initializer;
        }
    }

    /** String literal; {@code value} is the content without quotes, templates left as written. */
    @JsonPropertyOrder({"text","value"})
    public static final class StringLiteral extends SourceExpr {
        public final String value;

        @JsonCreator
        public StringLiteral(@JsonProperty("text") String text,
                             @JsonProperty("value") String value) {
            super(text);
            this.value = value == null ? "" : value;
        }

        public static StringLiteral of(String value) {
            return new StringLiteral("\"" + value + "\"", value);
        }
    }

    /** Numeric, boolean, character or {@code null} literal. The literal is the text. */
    @JsonPropertyOrder({"text"})
    public static final class Constant extends SourceExpr {
        @JsonCreator
        public Constant(@JsonProperty("text") String text) {
            super(text);
        }
    }

    @JsonPropertyOrder({"text","name"})
    public static final class NameRef extends SourceExpr {
        public final String name;

        @JsonCreator
        public NameRef(@JsonProperty("text") String text,
                       @JsonProperty("name") String name) {
            super(text);
            this.name = name == null ? this.text : name;
        }

        public static NameRef of(String name) {
            return new NameRef(name, name);
        }
    }

    @JsonPropertyOrder({"text"})
    public static final class Other extends SourceExpr {
        @JsonCreator
        public Other(@JsonProperty("text") String text) {
            super(text);
        }
    }
}
