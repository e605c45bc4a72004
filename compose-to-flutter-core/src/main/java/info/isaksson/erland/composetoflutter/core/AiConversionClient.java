package info.isaksson.erland.composetoflutter.core;

import java.io.IOException;

/**
 * Boundary to an external AI code-conversion service. Only units the scheduler flags as
 * too complex for the rules are offered, and only when enabled in {@link ConversionOptions}.
 */
public interface AiConversionClient {

    /** Used when no backend is configured. */
    AiConversionClient DISABLED = new AiConversionClient() {
        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public AiConversionResult convert(AiConversionRequest request) {
            return AiConversionResult.failure("AI conversion is not configured");
        }
    };

    boolean isAvailable();

    AiConversionResult convert(AiConversionRequest request) throws IOException;
}
