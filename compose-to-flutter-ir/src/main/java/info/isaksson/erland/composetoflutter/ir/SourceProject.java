package info.isaksson.erland.composetoflutter.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Front-end output for a whole source project: the ordered list of parsed units.
 *
 * <p>Unit order is registration order and is significant (symbol collisions resolve to the
 * last registered unit, and scheduling falls back to this order for residual units).</p>
 */
@JsonPropertyOrder({"schemaVersion","name","units"})
public final class SourceProject {
    public static final String SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    public final String name;
    public final List<SourceUnit> units;

    @JsonCreator
    public SourceProject(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("name") String name,
            @JsonProperty("units") List<SourceUnit> units
    ) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.name = name == null ? "project" : name;
        this.units = units == null ? List.of() : List.copyOf(units);
    }

    public static SourceProject of(String name, List<SourceUnit> units) {
        return new SourceProject(SCHEMA_VERSION, name, units);
    }

    /** Find a unit by its path, or null. */
    public SourceUnit unit(String path) {
        for (SourceUnit u : units) {
            if (u.path.equals(path)) return u;
        }
        return null;
    }
}
