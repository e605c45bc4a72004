package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A declaration as delivered by the front-end parser.
 *
 * <p>Classes carry members and constructor parameters, functions carry parameters, a return
 * type and a body, properties carry a type and an initializer. Fields that do not apply to a
 * kind are empty or null.</p>
 */
@JsonPropertyOrder({"kind","name","modifiers","annotations","superTypes","parameters","members","enumEntries","returnType","type","mutable","initializer","body"})
public final class SourceDeclaration {
    public final DeclarationKind kind;
    public final String name;
    public final List<String> modifiers;
    /** Annotation simple names without '@', e.g. {@code Composable}. */
    public final List<String> annotations;
    public final List<String> superTypes;
    public final List<SourceParameter> parameters;
    public final List<SourceDeclaration> members;
    public final List<String> enumEntries;
    public final String returnType;
    /** Declared property type. */
    public final String type;
    public final boolean mutable;
    public final String initializer;
    public final SourceExpr body;

    @JsonCreator
    public SourceDeclaration(
            @JsonProperty("kind") DeclarationKind kind,
            @JsonProperty("name") String name,
            @JsonProperty("modifiers") List<String> modifiers,
            @JsonProperty("annotations") List<String> annotations,
            @JsonProperty("superTypes") List<String> superTypes,
            @JsonProperty("parameters") List<SourceParameter> parameters,
            @JsonProperty("members") List<SourceDeclaration> members,
            @JsonProperty("enumEntries") List<String> enumEntries,
            @JsonProperty("returnType") String returnType,
            @JsonProperty("type") String type,
            @JsonProperty("mutable") boolean mutable,
            @JsonProperty("initializer") String initializer,
            @JsonProperty("body") SourceExpr body
    ) {
        this.kind = kind == null ? DeclarationKind.CLASS : kind;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
        this.superTypes = superTypes == null ? List.of() : List.copyOf(superTypes);
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.members = members == null ? List.of() : List.copyOf(members);
        this.enumEntries = enumEntries == null ? List.of() : List.copyOf(enumEntries);
        this.returnType = returnType;
        this.type = type;
        this.mutable = mutable;
        this.initializer = initializer;
        this.body = body;
    }

    public static SourceDeclaration function(String name, List<String> annotations, List<SourceParameter> parameters,
                                             String returnType, SourceExpr body) {
        return new SourceDeclaration(DeclarationKind.FUNCTION, name, null, annotations, null, parameters,
                null, null, returnType, null, false, null, body);
    }

    public static SourceDeclaration type(DeclarationKind kind, String name, List<String> superTypes,
                                         List<SourceParameter> parameters, List<SourceDeclaration> members) {
        return new SourceDeclaration(kind, name, null, null, superTypes, parameters, members, null,
                null, null, false, null, null);
    }

    public static SourceDeclaration property(String name, String type, boolean mutable, String initializer) {
        return new SourceDeclaration(DeclarationKind.PROPERTY, name, null, null, null, null, null, null,
                null, type, mutable, initializer, null);
    }

    public boolean hasAnnotation(String simpleName) {
        for (String a : annotations) {
            String n = a.startsWith("@") ? a.substring(1) : a;
            int dot = n.lastIndexOf('.');
            if (dot >= 0) n = n.substring(dot + 1);
            if (n.equals(simpleName)) return true;
        }
        return false;
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }

    /** True for functions annotated {@code @Composable}. */
    @JsonIgnore
    public boolean isComposable() {
        return kind == DeclarationKind.FUNCTION && hasAnnotation("Composable");
    }
}
