package info.isaksson.erland.composetoflutter.extract;

import java.util.Set;

/** Name tables that drive UI extraction. */
public final class ComposeNames {

    private ComposeNames() {}

    /** Style chain root and argument name. */
    public static final String MODIFIER = "Modifier";
    public static final String MODIFIER_ARGUMENT = "modifier";
    public static final String CONTENT_ARGUMENT = "content";

    /**
     * Calls that never become nodes themselves; UI inside their trailing closures is lifted
     * into the enclosing child list. Takes precedence over the capitalized-name rule.
     */
    public static final Set<String> TRANSPARENT_SCOPES = Set.of(
            "remember", "rememberSaveable", "rememberCoroutineScope",
            "LaunchedEffect", "SideEffect", "DisposableEffect",
            "derivedStateOf", "produceState", "snapshotFlow",
            "key", "CompositionLocalProvider", "item", "stickyHeader"
    );

    /** Lazy-list builders that behave like a loop over their first argument. */
    public static final Set<String> ITERATION_BUILDERS = Set.of("items", "itemsIndexed");

    /** Widgets recognized by name in addition to the capitalized-name rule. */
    public static final Set<String> KNOWN_WIDGETS = Set.of(
            "Column", "Row", "Box", "ConstraintLayout", "LazyColumn", "LazyRow",
            "LazyVerticalGrid", "LazyHorizontalGrid", "FlowRow", "FlowColumn",
            "Text", "Image", "Icon", "Spacer", "Divider", "Surface",
            "Button", "IconButton", "TextButton", "OutlinedButton", "FloatingActionButton",
            "TextField", "OutlinedTextField", "BasicTextField",
            "Checkbox", "RadioButton", "Switch", "Slider",
            "Card", "Scaffold", "TopAppBar", "BottomAppBar", "NavigationBar",
            "ModalBottomSheet", "AlertDialog", "Dialog",
            "CircularProgressIndicator", "LinearProgressIndicator",
            "DropdownMenu", "DropdownMenuItem", "ExposedDropdownMenuBox",
            "TabRow", "Tab", "HorizontalPager", "VerticalPager"
    );

    public static boolean isTransparentScope(String name) {
        return TRANSPARENT_SCOPES.contains(name);
    }

    public static boolean isWidget(String name) {
        if (name == null || name.isEmpty() || isTransparentScope(name)) return false;
        return Character.isUpperCase(name.charAt(0)) || KNOWN_WIDGETS.contains(name);
    }

    /** {@code androidx.compose.material3.Text} -> {@code Text}. */
    public static String simpleName(String callee) {
        if (callee == null) return "";
        int dot = callee.lastIndexOf('.');
        return dot >= 0 ? callee.substring(dot + 1) : callee;
    }
}
