package info.isaksson.erland.composetoflutter.testutil;

import info.isaksson.erland.composetoflutter.ir.ArgumentValue;
import info.isaksson.erland.composetoflutter.ir.ModifierDirective;
import info.isaksson.erland.composetoflutter.ir.UiNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for UI trees in emitter tests. */
public final class Trees {

    private Trees() {}

    public static UiNode.Widget widget(String name, Map<String, ArgumentValue> arguments,
                                       List<ModifierDirective> modifiers, UiNode... children) {
        return new UiNode.Widget(name, arguments, modifiers, List.of(children));
    }

    public static UiNode.Widget widget(String name, UiNode... children) {
        return widget(name, null, null, children);
    }

    public static UiNode.Widget text(String value) {
        return widget("Text", args("arg0", new ArgumentValue.StringValue(value)), null);
    }

    /** Alternating keys and values. */
    public static Map<String, ArgumentValue> args(Object... keyValues) {
        Map<String, ArgumentValue> out = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            out.put((String) keyValues[i], (ArgumentValue) keyValues[i + 1]);
        }
        return out;
    }

    public static ArgumentValue.Closure closure(String... statements) {
        return new ArgumentValue.Closure("{ " + String.join("; ", statements) + " }", null, List.of(statements), null);
    }

    public static ArgumentValue.Closure slot(UiNode... nodes) {
        return new ArgumentValue.Closure("{ ... }", null, null, List.of(nodes));
    }

    public static ArgumentValue.Reference ref(String name) {
        return new ArgumentValue.Reference(name);
    }

    public static ModifierDirective modifier(String name, String... positional) {
        Map<String, String> args = new LinkedHashMap<>();
        for (int i = 0; i < positional.length; i++) args.put(Integer.toString(i), positional[i]);
        return new ModifierDirective(name, args);
    }
}
