package info.isaksson.erland.composetoflutter.emitter;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal deterministic warning produced during analysis or generation. */
@JsonPropertyOrder({"code","message","context"})
public final class GenerationWarning {

    /** Warning code stable across versions. */
    public final String code;

    public final String message;

    /** Structured context, e.g. {@code unit} and {@code name}. */
    public final Map<String, String> context;

    public GenerationWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override
    public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}
