package info.isaksson.erland.composetoflutter.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A unit that could not be converted. Other units are unaffected. */
@JsonPropertyOrder({"code","message","unitPath"})
public final class ConversionError {

    public static final String CONVERSION_ERROR = "CONVERSION_ERROR";

    public final String code;
    public final String message;
    public final String unitPath;

    public ConversionError(String code, String message, String unitPath) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = message == null ? "" : message;
        this.unitPath = unitPath;
    }

    @Override
    public String toString() {
        return code + ": " + message + (unitPath == null ? "" : " (" + unitPath + ")");
    }
}
