package info.isaksson.erland.composetoflutter.core;

/** Outcome of an AI conversion attempt: either code or an error description. */
public final class AiConversionResult {
    public final boolean success;
    public final String code;
    public final String error;

    private AiConversionResult(boolean success, String code, String error) {
        this.success = success;
        this.code = code;
        this.error = error;
    }

    public static AiConversionResult success(String code) {
        if (code == null) throw new IllegalArgumentException("code must not be null");
        return new AiConversionResult(true, code, null);
    }

    public static AiConversionResult failure(String error) {
        return new AiConversionResult(false, null, error == null ? "unknown error" : error);
    }
}
