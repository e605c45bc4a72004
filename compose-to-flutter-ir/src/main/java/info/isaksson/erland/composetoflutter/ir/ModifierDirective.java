package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One call of a style chain such as {@code Modifier.padding(16.dp).clickable { ... }}.
 *
 * <p>Arguments keep their raw source text. Keys are parameter names for named arguments and
 * the positional index ({@code "0"}, {@code "1"}, ...) otherwise.</p>
 */
@JsonPropertyOrder({"name","arguments"})
public final class ModifierDirective {
    public final String name;
    public final Map<String, String> arguments;

    public ModifierDirective(String name, Map<String, String> arguments) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.arguments = arguments == null || arguments.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ModifierDirective of(String name) {
        return new ModifierDirective(name, null);
    }

    public static ModifierDirective of(String name, String firstPositional) {
        Map<String, String> args = new LinkedHashMap<>();
        args.put("0", firstPositional);
        return new ModifierDirective(name, args);
    }

    /** Named argument, falling back to the given positional index. */
    public String argument(String name, int position) {
        String v = arguments.get(name);
        return v != null ? v : arguments.get(Integer.toString(position));
    }

    public String positional(int position) {
        return arguments.get(Integer.toString(position));
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
