package info.isaksson.erland.composetoflutter.mapping;

import info.isaksson.erland.composetoflutter.ir.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Maps source type text to target type text.
 *
 * <p>Lookup order for a base name: configured overrides, domain types, primitives, collections.
 * Unknown names pass through unchanged. Mapping target-form text again returns it unchanged.</p>
 */
public final class TypeMapper {

    static final Map<String, String> DOMAIN_TYPES = table(
            "Dp", "double",
            "Sp", "double",
            "TextUnit", "double",
            "Modifier", "Widget",
            "Color", "Color",
            "Offset", "Offset",
            "Size", "Size",
            "Rect", "Rect",
            "PaddingValues", "EdgeInsets",
            "Shape", "ShapeBorder",
            "Painter", "ImageProvider",
            "ImageVector", "IconData",
            "MutableState", "ValueNotifier",
            "StateFlow", "Stream",
            "MutableStateFlow", "StreamController",
            "SharedFlow", "Stream",
            "MutableSharedFlow", "StreamController",
            "Flow", "Stream",
            "LiveData", "ValueNotifier",
            "MutableLiveData", "ValueNotifier",
            "Deferred", "Future",
            "Job", "Future<void>",
            "Context", "BuildContext",
            "Uri", "Uri",
            "Date", "DateTime",
            "LocalDate", "DateTime",
            "LocalDateTime", "DateTime",
            "Instant", "DateTime",
            "Duration", "Duration",
            "Throwable", "Object",
            "Exception", "Exception"
    );

    static final Map<String, String> PRIMITIVE_TYPES = table(
            "Int", "int",
            "Long", "int",
            "Short", "int",
            "Byte", "int",
            "Float", "double",
            "Double", "double",
            "Number", "num",
            "Char", "String",
            "String", "String",
            "CharSequence", "String",
            "Boolean", "bool",
            "Unit", "void",
            "Nothing", "Never",
            "Any", "dynamic",
            "*", "dynamic"
    );

    static final Map<String, String> COLLECTION_TYPES = table(
            "List", "List",
            "MutableList", "List",
            "ArrayList", "List",
            "Set", "Set",
            "MutableSet", "Set",
            "HashSet", "Set",
            "LinkedHashSet", "Set",
            "Map", "Map",
            "MutableMap", "Map",
            "HashMap", "Map",
            "LinkedHashMap", "Map",
            "Array", "List",
            "IntArray", "List<int>",
            "LongArray", "List<int>",
            "FloatArray", "List<double>",
            "DoubleArray", "List<double>",
            "BooleanArray", "List<bool>",
            "Collection", "Iterable",
            "Iterable", "Iterable",
            "Sequence", "Iterable",
            "Pair", "MapEntry"
    );

    /** Target names that need no mapping and are never reported as unmapped. */
    static final Set<String> TARGET_NATIVE = Set.of(
            "Widget", "BuildContext", "Future", "Stream", "StreamController", "ValueNotifier",
            "ValueListenable", "Object", "Function", "VoidCallback", "MapEntry", "DateTime",
            "EdgeInsets", "TextStyle", "FontWeight", "Alignment", "IconData", "ImageProvider",
            "ShapeBorder", "Key", "State", "Never", "Iterable", "Record"
    );

    private static final Pattern TARGET_FUNCTION = Pattern.compile(".*\\bFunction\\s*\\(.*");
    private static final Pattern SUSPEND_FUNCTION = Pattern.compile("^\\(?\\s*suspend\\s.*");

    private final Map<String, String> overrides;

    public TypeMapper() {
        this(null);
    }

    public TypeMapper(Map<String, String> overrides) {
        this.overrides = overrides == null || overrides.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    /** Target type for the given source type text; {@code dynamic} for blank input. */
    public String map(String sourceType) {
        if (sourceType == null || sourceType.isBlank()) return "dynamic";
        String t = sourceType.trim();
        String whole = overrides.get(t);
        if (whole != null) return whole;
        if (TARGET_FUNCTION.matcher(t).matches()) return t;
        return render(TypeDescriptor.parse(t), SUSPEND_FUNCTION.matcher(t).matches());
    }

    /**
     * Base names in the type text that no table maps and that are not in {@code knownNames}.
     * Lower-case names are taken as already target-form.
     */
    public SortedSet<String> unmappedNames(String sourceType, Set<String> knownNames) {
        SortedSet<String> out = new TreeSet<>();
        if (sourceType == null || sourceType.isBlank()) return out;
        if (TARGET_FUNCTION.matcher(sourceType).matches()) return out;
        for (String name : TypeDescriptor.parse(sourceType).referencedNames()) {
            String simple = simpleName(name);
            if (simple.isEmpty() || !Character.isUpperCase(simple.charAt(0))) continue;
            if (lookup(name) != null || TARGET_NATIVE.contains(simple)) continue;
            if (knownNames != null && (knownNames.contains(name) || knownNames.contains(simple))) continue;
            out.add(name);
        }
        return out;
    }

    private String render(TypeDescriptor d, boolean suspend) {
        if (d.isFunction()) {
            List<String> params = new ArrayList<>();
            for (TypeDescriptor p : d.functionParameters) params.add(render(p, false));
            String ret = render(d.returnType, false);
            if (suspend) ret = "Future<" + ret + ">";
            String fn = ret + " Function(" + String.join(", ", params) + ")";
            return d.nullable ? fn + "?" : fn;
        }
        String mapped = lookup(d.base);
        String base = mapped != null ? mapped : d.base;
        if (!d.arguments.isEmpty() && base.indexOf('<') < 0) {
            List<String> args = new ArrayList<>();
            for (TypeDescriptor a : d.arguments) args.add(render(a, false));
            base = base + "<" + String.join(", ", args) + ">";
        }
        if (d.nullable && !base.equals("dynamic") && !base.endsWith("?")) {
            base = base + "?";
        }
        return base;
    }

    private String lookup(String name) {
        String v = overrides.get(name);
        if (v != null) return v;
        String simple = simpleName(name);
        v = overrides.get(simple);
        if (v != null) return v;
        v = DOMAIN_TYPES.get(simple);
        if (v != null) return v;
        v = PRIMITIVE_TYPES.get(simple);
        if (v != null) return v;
        return COLLECTION_TYPES.get(simple);
    }

    private static String simpleName(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    private static Map<String, String> table(String... pairs) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(m);
    }
}
