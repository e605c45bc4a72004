package info.isaksson.erland.composetoflutter.extract;

import info.isaksson.erland.composetoflutter.ir.ArgumentValue;
import info.isaksson.erland.composetoflutter.ir.SourceExpr;
import info.isaksson.erland.composetoflutter.ir.UiNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/** Maps call argument expressions to {@link ArgumentValue}s. */
final class ArgumentClassifier {

    private static final Pattern INT = Pattern.compile("-?\\d+[lL]?");
    private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)[fF]?");

    private final Function<SourceExpr, List<UiNode>> nodeExtractor;

    ArgumentClassifier(Function<SourceExpr, List<UiNode>> nodeExtractor) {
        this.nodeExtractor = nodeExtractor;
    }

    ArgumentValue classify(SourceExpr expr) {
        if (expr == null) return ArgumentValue.NullValue.INSTANCE;
        if (expr instanceof SourceExpr.StringLiteral s) {
            return new ArgumentValue.StringValue(s.value);
        }
        if (expr instanceof SourceExpr.Constant || expr instanceof SourceExpr.Other) {
            return literal(expr.text.trim());
        }
        if (expr instanceof SourceExpr.Qualified) {
            return new ArgumentValue.Reference(expr.text.trim());
        }
        if (expr instanceof SourceExpr.NameRef n) {
            return n.name.equals("null") ? ArgumentValue.NullValue.INSTANCE : literal(n.name);
        }
        if (expr instanceof SourceExpr.Call c) {
            return new ArgumentValue.CallValue(c.callee, argumentTexts(c), c.text);
        }
        if (expr instanceof SourceExpr.Lambda l) {
            return closure(l);
        }
        return new ArgumentValue.Raw(expr.text);
    }

    ArgumentValue.Closure closure(SourceExpr.Lambda lambda) {
        List<String> statements = new ArrayList<>();
        for (SourceExpr s : lambda.body.statements) {
            statements.add(s.text.trim());
        }
        if (statements.isEmpty() && !lambda.body.text.isBlank()) {
            statements.add(lambda.body.text.trim());
        }
        return new ArgumentValue.Closure(lambda.text, lambda.parameters, statements, nodeExtractor.apply(lambda.body));
    }

    static List<String> argumentTexts(SourceExpr.Call call) {
        List<String> out = new ArrayList<>();
        for (SourceExpr.Argument a : call.arguments) {
            out.add(a.name == null ? a.value.text : a.name + " = " + a.value.text);
        }
        for (SourceExpr.Lambda l : call.trailingLambdas) {
            out.add(l.text);
        }
        return out;
    }

    static ArgumentValue literal(String text) {
        if (text.equals("true") || text.equals("false")) {
            return new ArgumentValue.BoolValue(Boolean.parseBoolean(text));
        }
        if (text.equals("null")) {
            return ArgumentValue.NullValue.INSTANCE;
        }
        if (INT.matcher(text).matches()) {
            String digits = text.endsWith("l") || text.endsWith("L") ? text.substring(0, text.length() - 1) : text;
            try {
                return new ArgumentValue.IntValue(Long.parseLong(digits));
            } catch (NumberFormatException e) {
                return new ArgumentValue.Raw(text);
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            String digits = text.endsWith("f") || text.endsWith("F") ? text.substring(0, text.length() - 1) : text;
            return new ArgumentValue.DoubleValue(Double.parseDouble(digits));
        }
        if (isIdentifierPath(text)) {
            return new ArgumentValue.Reference(text);
        }
        return new ArgumentValue.Raw(text);
    }

    private static boolean isIdentifierPath(String text) {
        return text.matches("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");
    }
}
