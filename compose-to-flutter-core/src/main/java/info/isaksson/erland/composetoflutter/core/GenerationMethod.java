package info.isaksson.erland.composetoflutter.core;

/** How the code of a unit output was produced. */
public enum GenerationMethod {
    RULE_BASED,
    AI_ASSISTED
}
