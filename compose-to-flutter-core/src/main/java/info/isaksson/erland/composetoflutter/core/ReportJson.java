package info.isaksson.erland.composetoflutter.core;

import info.isaksson.erland.composetoflutter.ir.JsonSupport;

import java.io.IOException;
import java.nio.file.Path;

/** Deterministic JSON rendering of a {@link ConversionReport}. */
public final class ReportJson {
    private ReportJson() {}

    public static String toJsonString(ConversionReport report) throws IOException {
        if (report == null) throw new IllegalArgumentException("report must not be null");
        return JsonSupport.toJsonString(report);
    }

    public static void write(ConversionReport report, Path path) throws IOException {
        if (report == null) throw new IllegalArgumentException("report must not be null");
        JsonSupport.write(report, path);
    }
}
