package info.isaksson.erland.composetoflutter.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"unitPath","priority","dependencyCount","complexity","requiresAi"})
public final class ConversionTask {
    public final String unitPath;
    public final ConversionPriority priority;
    public final int dependencyCount;
    public final int complexity;
    @JsonProperty("requiresAi")
    public final boolean requiresAi;

    public ConversionTask(String unitPath, ConversionPriority priority, int dependencyCount, int complexity, boolean requiresAi) {
        this.unitPath = Objects.requireNonNull(unitPath, "unitPath must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.dependencyCount = dependencyCount;
        this.complexity = complexity;
        this.requiresAi = requiresAi;
    }

    @Override
    public String toString() {
        return unitPath + "[" + priority + ", deps=" + dependencyCount + ", complexity=" + complexity
                + (requiresAi ? ", ai" : "") + "]";
    }
}
