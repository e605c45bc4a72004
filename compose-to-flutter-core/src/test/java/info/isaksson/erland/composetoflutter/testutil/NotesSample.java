package info.isaksson.erland.composetoflutter.testutil;

import info.isaksson.erland.composetoflutter.ir.SourceJson;
import info.isaksson.erland.composetoflutter.ir.SourceProject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The notes app sample under {@code samples/notes-app}: its unit paths and the target files
 * they convert to once the shared {@code com.example.notes} prefix is dropped.
 */
public final class NotesSample {

    public static final String SCREEN = "app/src/main/java/com/example/notes/ui/NotesScreen.kt";
    public static final String CARD = "app/src/main/java/com/example/notes/ui/NoteCard.kt";
    public static final String NOTE = "app/src/main/java/com/example/notes/model/Note.kt";

    public static final String SCREEN_TARGET = "ui/notes_screen.dart";
    public static final String CARD_TARGET = "ui/note_card.dart";
    public static final String NOTE_TARGET = "model/note.dart";

    public static final int UNIT_COUNT = 4;

    private NotesSample() {}

    public static SourceProject load() throws IOException {
        Path dir = Path.of("").toAbsolutePath().normalize();
        while (dir != null && !Files.isDirectory(dir.resolve("samples/notes-app"))) dir = dir.getParent();
        if (dir == null) throw new IllegalStateException("samples/notes-app not found above the working directory");
        return SourceJson.read(dir.resolve("samples/notes-app/notes-project.json"));
    }
}
