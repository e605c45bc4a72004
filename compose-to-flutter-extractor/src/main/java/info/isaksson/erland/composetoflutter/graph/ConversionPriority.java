package info.isaksson.erland.composetoflutter.graph;

/** Scheduling priority; declaration order is sort order. */
public enum ConversionPriority {
    /** No dependencies. */
    HIGH,
    /** Carries UI components. */
    MEDIUM,
    LOW
}
