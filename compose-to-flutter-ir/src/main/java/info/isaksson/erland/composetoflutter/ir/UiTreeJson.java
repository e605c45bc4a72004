package info.isaksson.erland.composetoflutter.ir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Debug dump of extracted UI trees, keyed by unit path.
 *
 * <p>Units are sorted by path; trees keep their declaration order.</p>
 */
public final class UiTreeJson {

    private UiTreeJson() {}

    public static String toJsonString(Map<String, List<UiTree>> treesByUnit) throws IOException {
        return JsonSupport.toJsonString(sorted(treesByUnit));
    }

    public static void write(Map<String, List<UiTree>> treesByUnit, Path path) throws IOException {
        JsonSupport.write(sorted(treesByUnit), path);
    }

    private static Map<String, List<UiTree>> sorted(Map<String, List<UiTree>> in) {
        if (in == null) throw new IllegalArgumentException("trees are null");
        List<String> keys = new ArrayList<>(in.keySet());
        keys.sort(Comparator.naturalOrder());
        Map<String, List<UiTree>> out = new LinkedHashMap<>();
        for (String k : keys) {
            out.put(k, in.get(k) == null ? List.of() : in.get(k));
        }
        return out;
    }
}
