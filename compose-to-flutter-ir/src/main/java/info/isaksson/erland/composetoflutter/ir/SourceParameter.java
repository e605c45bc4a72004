package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Function or primary-constructor parameter. */
@JsonPropertyOrder({"name","type","defaultValue","nullable","vararg","mutable"})
public final class SourceParameter {
    public final String name;
    /** Source type text, e.g. {@code List<String>?}. Null when not declared. */
    public final String type;
    public final String defaultValue;
    public final boolean nullable;
    public final boolean vararg;
    /** Constructor parameters declared with {@code var}. */
    public final boolean mutable;

    @JsonCreator
    public SourceParameter(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("defaultValue") String defaultValue,
            @JsonProperty("nullable") Boolean nullable,
            @JsonProperty("vararg") boolean vararg,
            @JsonProperty("mutable") boolean mutable
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = type;
        this.defaultValue = defaultValue;
        // An explicit flag wins; otherwise derive from the type text.
        this.nullable = nullable != null ? nullable : (type != null && type.trim().endsWith("?"));
        this.vararg = vararg;
        this.mutable = mutable;
    }

    public static SourceParameter of(String name, String type) {
        return new SourceParameter(name, type, null, null, false, false);
    }

    public static SourceParameter of(String name, String type, String defaultValue) {
        return new SourceParameter(name, type, defaultValue, null, false, false);
    }

    public boolean hasDefault() {
        return defaultValue != null && !defaultValue.isBlank();
    }
}
