package info.isaksson.erland.composetoflutter.emitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings during a conversion.
 *
 * <p>Warnings are deterministic: final output is sorted by (code, message, contextString).
 * Collection is synchronized so units converted in parallel may share one collector.</p>
 */
public final class GenerationWarnings {

    public static final String CYCLE = "CYCLE";
    public static final String UNKNOWN_MODIFIER = "UNKNOWN_MODIFIER";
    public static final String UNKNOWN_WIDGET = "UNKNOWN_WIDGET";
    public static final String UNMAPPED_TYPE = "UNMAPPED_TYPE";
    public static final String AI_FALLBACK = "AI_FALLBACK";

    private final List<GenerationWarning> warnings = new ArrayList<>();

    public void warn(String code, String message) {
        warn(code, message, null);
    }

    public synchronized void warn(String code, String message, Map<String, String> context) {
        warnings.add(new GenerationWarning(code, message, context == null ? Collections.emptyMap() : context));
    }

    public void warn(String code, String message, String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        warn(code, message, ctx);
    }

    public void warn(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        ctx.put(k2, v2);
        warn(code, message, ctx);
    }

    public synchronized void addAll(GenerationWarnings other) {
        if (other == null || other == this) return;
        warnings.addAll(other.snapshot());
    }

    public synchronized int size() {
        return warnings.size();
    }

    public List<GenerationWarning> toDeterministicList() {
        List<GenerationWarning> out = snapshot();
        out.sort(Comparator
                .comparing((GenerationWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private synchronized List<GenerationWarning> snapshot() {
        return new ArrayList<>(warnings);
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        // stable serialization: key-sorted
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
