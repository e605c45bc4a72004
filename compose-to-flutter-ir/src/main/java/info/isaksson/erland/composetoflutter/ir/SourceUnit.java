package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** One source file: package, imports and top-level declarations. */
@JsonPropertyOrder({"path","packageName","imports","declarations","text"})
public final class SourceUnit {
    public final String path;
    public final String packageName;
    public final List<String> imports;
    public final List<SourceDeclaration> declarations;

    /** Raw file text, optional. Used for line statistics and the AI conversion request. */
    public final String text;

    @JsonCreator
    public SourceUnit(
            @JsonProperty("path") String path,
            @JsonProperty("packageName") String packageName,
            @JsonProperty("imports") List<String> imports,
            @JsonProperty("declarations") List<SourceDeclaration> declarations,
            @JsonProperty("text") String text
    ) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.packageName = packageName == null ? "" : packageName;
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        this.text = text;
    }

    /** File name without directories and extension, e.g. {@code LoginScreen} for {@code ui/LoginScreen.kt}. */
    @JsonIgnore
    public String baseName() {
        String p = path.replace('\\', '/');
        int slash = p.lastIndexOf('/');
        String file = slash >= 0 ? p.substring(slash + 1) : p;
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    /** Qualify a simple name with this unit's package. */
    public String qualify(String simpleName) {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    @JsonIgnore
    public int lineCount() {
        if (text == null || text.isEmpty()) return 0;
        return (int) text.lines().count();
    }
}
