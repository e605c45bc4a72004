package info.isaksson.erland.composetoflutter.ir;

/** How a reactive state variable was created in the source component. */
public enum StateFlavor {
    PLAIN,
    PERSISTED,
    LIST_CELL,
    MAP_CELL,
    DERIVED,
    STREAM_PROJECTED
}
