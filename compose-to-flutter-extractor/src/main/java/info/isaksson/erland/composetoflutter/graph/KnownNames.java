package info.isaksson.erland.composetoflutter.graph;

import java.util.Set;

/** Names that never produce dependency edges: language builtins and framework primitives. */
final class KnownNames {

    private KnownNames() {}

    static final Set<String> BUILTIN_TYPES = Set.of(
            "String", "Int", "Long", "Float", "Double", "Boolean", "Char", "Byte", "Short",
            "Unit", "Any", "Nothing", "List", "Set", "Map", "Array", "Pair", "Triple",
            "Sequence", "Iterable", "Collection", "MutableList", "MutableSet", "MutableMap",
            "Result", "Lazy", "Comparable", "Throwable", "Exception", "Error",
            "Modifier", "Color", "Dp", "Sp", "TextUnit", "IntOffset", "IntSize",
            "Offset", "Size", "Alignment", "Arrangement", "ContentScale",
            "PaddingValues", "CornerSize", "Shape", "TextStyle", "FontWeight"
    );

    static final Set<String> UI_PRIMITIVES = Set.of(
            "Column", "Row", "Box", "Text", "Button", "Image", "Icon",
            "Scaffold", "TopAppBar", "LazyColumn", "LazyRow", "Card",
            "Surface", "Spacer", "Divider", "Checkbox", "Switch", "TextField"
    );

    static boolean isExcluded(String simpleName) {
        return BUILTIN_TYPES.contains(simpleName) || UI_PRIMITIVES.contains(simpleName);
    }
}
