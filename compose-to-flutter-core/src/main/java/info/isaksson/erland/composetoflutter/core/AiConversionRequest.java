package info.isaksson.erland.composetoflutter.core;

import java.util.Objects;

/** Everything an AI conversion backend gets to see for one unit. */
public final class AiConversionRequest {
    public final String unitPath;
    public final String targetPath;

    /** Raw source text; may be null when the front-end did not ship it. */
    public final String sourceText;

    /** The rule-based translation, as a starting point. */
    public final String ruleBasedCode;

    public final int complexity;

    /** Target state-management convention, e.g. {@code riverpod}. */
    public final String stateManagement;

    /** Target navigation convention, e.g. {@code go_router}. */
    public final String navigation;

    public AiConversionRequest(String unitPath, String targetPath, String sourceText, String ruleBasedCode, int complexity,
                               String stateManagement, String navigation) {
        this.unitPath = Objects.requireNonNull(unitPath, "unitPath must not be null");
        this.targetPath = targetPath;
        this.sourceText = sourceText;
        this.ruleBasedCode = ruleBasedCode == null ? "" : ruleBasedCode;
        this.complexity = complexity;
        this.stateManagement = stateManagement;
        this.navigation = navigation;
    }
}
