package info.isaksson.erland.composetoflutter.emitter;

/** Shape of the UI class generated for a unit. */
public enum ComponentShape {
    STATELESS,
    STATEFUL,
    /** The unit declares no components. */
    NONE
}
