package info.isaksson.erland.composetoflutter.dart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Target expression tree, printed by {@link DartPrinter}. */
public sealed interface DartExpr permits DartExpr.Call, DartExpr.Code, DartExpr.ListLiteral,
        DartExpr.Ternary, DartExpr.Spread, DartExpr.Callback {

    /** Constructor or function invocation with positional and named arguments. */
    final class Call implements DartExpr {
        public final String callee;
        public final List<DartExpr> positional;
        public final Map<String, DartExpr> named;
        public final boolean constant;

        private Call(String callee, List<DartExpr> positional, Map<String, DartExpr> named, boolean constant) {
            this.callee = Objects.requireNonNull(callee, "callee must not be null");
            this.positional = List.copyOf(positional);
            this.named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
            this.constant = constant;
        }

        public static Call of(String callee, DartExpr... positional) {
            Builder b = builder(callee);
            for (DartExpr p : positional) b.positional(p);
            return b.build();
        }

        public static Builder builder(String callee) {
            return new Builder(callee);
        }

        public boolean hasArguments() {
            return !positional.isEmpty() || !named.isEmpty();
        }

        public DartExpr namedArgument(String name) {
            return named.get(name);
        }

        public static final class Builder {
            private final String callee;
            private final List<DartExpr> positional = new ArrayList<>();
            private final Map<String, DartExpr> named = new LinkedHashMap<>();
            private boolean constant;

            private Builder(String callee) {
                this.callee = callee;
            }

            public Builder positional(DartExpr value) {
                positional.add(Objects.requireNonNull(value, "value must not be null"));
                return this;
            }

            /** Later values for the same name replace earlier ones, keeping the first position. */
            public Builder named(String name, DartExpr value) {
                named.put(name, Objects.requireNonNull(value, "value must not be null"));
                return this;
            }

            public Builder named(String name, String code) {
                return named(name, new Code(code));
            }

            public boolean hasNamed(String name) {
                return named.containsKey(name);
            }

            public Builder constant(boolean value) {
                this.constant = value;
                return this;
            }

            public Call build() {
                return new Call(callee, positional, named, constant);
            }
        }
    }

    /** Verbatim target code. */
    final class Code implements DartExpr {
        public final String text;

        public Code(String text) {
            this.text = text == null ? "" : text;
        }
    }

    final class ListLiteral implements DartExpr {
        public final List<DartExpr> items;
        public final boolean constant;

        public ListLiteral(List<DartExpr> items, boolean constant) {
            this.items = items == null ? List.of() : List.copyOf(items);
            this.constant = constant;
        }
    }

    /** {@code condition ? whenTrue : whenFalse}. */
    final class Ternary implements DartExpr {
        public final String condition;
        public final DartExpr whenTrue;
        public final DartExpr whenFalse;

        public Ternary(String condition, DartExpr whenTrue, DartExpr whenFalse) {
            this.condition = Objects.requireNonNull(condition, "condition must not be null");
            this.whenTrue = Objects.requireNonNull(whenTrue, "whenTrue must not be null");
            this.whenFalse = Objects.requireNonNull(whenFalse, "whenFalse must not be null");
        }
    }

    /** {@code ...source.map((variable) => body)} inside a list literal. */
    final class Spread implements DartExpr {
        public final String source;
        public final String variable;
        public final DartExpr body;

        public Spread(String source, String variable, DartExpr body) {
            this.source = Objects.requireNonNull(source, "source must not be null");
            this.variable = Objects.requireNonNull(variable, "variable must not be null");
            this.body = Objects.requireNonNull(body, "body must not be null");
        }
    }

    /**
     * Function literal. With no statements and a result it prints in arrow form; otherwise as
     * a block that ends in {@code return result;} when a result is present.
     */
    final class Callback implements DartExpr {
        public final List<String> parameters;
        public final List<String> statements;
        public final DartExpr result;

        public Callback(List<String> parameters, List<String> statements, DartExpr result) {
            this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
            this.statements = statements == null ? List.of() : List.copyOf(statements);
            this.result = result;
        }

        public static Callback arrow(List<String> parameters, DartExpr result) {
            return new Callback(parameters, null, result);
        }

        public static Callback block(List<String> parameters, List<String> statements) {
            return new Callback(parameters, statements, null);
        }
    }
}
