package info.isaksson.erland.composetoflutter.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Source widget names and argument names to their target counterparts. */
public final class WidgetMappings {

    static final Map<String, String> WIDGETS;
    static final Map<String, String> ARGUMENTS;

    static {
        Map<String, String> w = new LinkedHashMap<>();
        // basic
        w.put("Text", "Text");
        w.put("Button", "ElevatedButton");
        w.put("ElevatedButton", "ElevatedButton");
        w.put("FilledButton", "FilledButton");
        w.put("TextButton", "TextButton");
        w.put("OutlinedButton", "OutlinedButton");
        w.put("IconButton", "IconButton");
        w.put("FloatingActionButton", "FloatingActionButton");
        w.put("ExtendedFloatingActionButton", "FloatingActionButton.extended");
        w.put("TextField", "TextField");
        w.put("OutlinedTextField", "TextField");
        w.put("BasicTextField", "TextField");
        w.put("Checkbox", "Checkbox");
        w.put("Switch", "Switch");
        w.put("RadioButton", "Radio");
        w.put("Slider", "Slider");
        w.put("RangeSlider", "RangeSlider");
        w.put("Image", "Image");
        w.put("Icon", "Icon");
        w.put("AsyncImage", "Image.network");
        w.put("Divider", "Divider");
        w.put("HorizontalDivider", "Divider");
        w.put("VerticalDivider", "VerticalDivider");
        w.put("Spacer", "Spacer");
        w.put("CircularProgressIndicator", "CircularProgressIndicator");
        w.put("LinearProgressIndicator", "LinearProgressIndicator");
        // layout
        w.put("Column", "Column");
        w.put("Row", "Row");
        w.put("Box", "Stack");
        w.put("BoxWithConstraints", "LayoutBuilder");
        w.put("LazyColumn", "ListView");
        w.put("LazyRow", "ListView");
        w.put("LazyVerticalGrid", "GridView");
        w.put("LazyHorizontalGrid", "GridView");
        w.put("Scaffold", "Scaffold");
        w.put("Surface", "Material");
        w.put("Card", "Card");
        w.put("ElevatedCard", "Card");
        w.put("OutlinedCard", "Card");
        w.put("ConstraintLayout", "Stack");
        w.put("FlowRow", "Wrap");
        w.put("FlowColumn", "Wrap");
        // material
        w.put("TopAppBar", "AppBar");
        w.put("CenterAlignedTopAppBar", "AppBar");
        w.put("SmallTopAppBar", "AppBar");
        w.put("MediumTopAppBar", "AppBar");
        w.put("LargeTopAppBar", "AppBar");
        w.put("NavigationBar", "NavigationBar");
        w.put("NavigationBarItem", "NavigationDestination");
        w.put("NavigationRail", "NavigationRail");
        w.put("ModalNavigationDrawer", "Drawer");
        w.put("NavigationDrawer", "Drawer");
        w.put("BottomAppBar", "BottomAppBar");
        w.put("TabRow", "TabBar");
        w.put("ScrollableTabRow", "TabBar");
        w.put("Tab", "Tab");
        w.put("AlertDialog", "AlertDialog");
        w.put("Dialog", "Dialog");
        w.put("ModalBottomSheet", "BottomSheet");
        w.put("BottomSheetScaffold", "Scaffold");
        w.put("Snackbar", "SnackBar");
        w.put("Badge", "Badge");
        w.put("AssistChip", "Chip");
        w.put("Chip", "Chip");
        w.put("FilterChip", "FilterChip");
        w.put("InputChip", "InputChip");
        w.put("DropdownMenu", "PopupMenuButton");
        w.put("DropdownMenuItem", "PopupMenuItem");
        w.put("HorizontalPager", "PageView");
        w.put("VerticalPager", "PageView");
        // animation
        w.put("AnimatedVisibility", "Visibility");
        w.put("Crossfade", "AnimatedSwitcher");
        w.put("AnimatedContent", "AnimatedSwitcher");
        WIDGETS = Collections.unmodifiableMap(w);

        Map<String, String> a = new LinkedHashMap<>();
        a.put("onClick", "onPressed");
        a.put("onValueChange", "onChanged");
        a.put("onCheckedChange", "onChanged");
        a.put("checked", "value");
        a.put("contentDescription", "semanticsLabel");
        a.put("containerColor", "backgroundColor");
        a.put("tint", "color");
        a.put("selected", "selected");
        a.put("visible", "visible");
        a.put("targetState", "child");
        ARGUMENTS = Collections.unmodifiableMap(a);
    }

    private final Map<String, String> overrides;

    public WidgetMappings() {
        this(null);
    }

    public WidgetMappings(Map<String, String> overrides) {
        this.overrides = overrides == null || overrides.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public boolean isKnown(String sourceName) {
        return overrides.containsKey(sourceName) || WIDGETS.containsKey(sourceName);
    }

    /** Mapped widget name, or the source name itself when unknown. */
    public String widgetName(String sourceName) {
        String v = overrides.get(sourceName);
        if (v != null) return v;
        return WIDGETS.getOrDefault(sourceName, sourceName);
    }

    /** True when configuration replaces the built-in rendering of this widget. */
    public boolean isOverridden(String sourceName) {
        return overrides.containsKey(sourceName);
    }

    public static String argumentName(String sourceName) {
        return ARGUMENTS.getOrDefault(sourceName, sourceName);
    }
}
