package info.isaksson.erland.composetoflutter.ir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads and writes the front-end contract ({@link SourceProject}) as JSON. */
public final class SourceJson {

    private SourceJson() {}

    public static SourceProject read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static SourceProject read(InputStream in) throws IOException {
        if (in == null) throw new IllegalArgumentException("input stream is null");
        return JsonSupport.mapper().readValue(in, SourceProject.class);
    }

    public static SourceProject readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return JsonSupport.mapper().readValue(json, SourceProject.class);
    }

    public static void write(SourceProject project, Path path) throws IOException {
        JsonSupport.write(project, path);
    }

    public static String toJsonString(SourceProject project) throws IOException {
        return JsonSupport.toJsonString(project);
    }
}
