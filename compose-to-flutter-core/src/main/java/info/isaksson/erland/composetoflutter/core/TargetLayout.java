package info.isaksson.erland.composetoflutter.core;

import info.isaksson.erland.composetoflutter.ir.SourceProject;
import info.isaksson.erland.composetoflutter.ir.SourceUnit;
import info.isaksson.erland.composetoflutter.mapping.ExpressionRewriter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Where each unit lands in the target tree.
 *
 * <p>The package segments shared by every unit are dropped and the rest become directories,
 * so {@code com.example.notes.ui.NotesScreen} lands in {@code ui/notes_screen.dart} when all
 * units live under {@code com.example.notes}.</p>
 */
public final class TargetLayout {

    public static final String EXTENSION = ".dart";

    private final List<String> commonPackage;

    private TargetLayout(List<String> commonPackage) {
        this.commonPackage = List.copyOf(commonPackage);
    }

    public static TargetLayout of(SourceProject project) {
        if (project == null) throw new IllegalArgumentException("project must not be null");
        List<String> common = null;
        for (SourceUnit u : project.units) {
            if (u.packageName.isEmpty()) continue;
            List<String> segments = Arrays.asList(u.packageName.split("\\."));
            if (common == null) {
                common = new ArrayList<>(segments);
                continue;
            }
            int n = 0;
            while (n < common.size() && n < segments.size() && common.get(n).equals(segments.get(n))) n++;
            common = new ArrayList<>(common.subList(0, n));
        }
        return new TargetLayout(common == null ? List.of() : common);
    }

    /** snake_case of the unit's base name plus the target extension. */
    public static String fileName(SourceUnit unit) {
        return ExpressionRewriter.snakeCase(unit.baseName()) + EXTENSION;
    }

    public String targetPath(SourceUnit unit) {
        if (unit == null) throw new IllegalArgumentException("unit must not be null");
        List<String> segments = unit.packageName.isEmpty()
                ? List.of()
                : Arrays.asList(unit.packageName.split("\\."));
        int skip = 0;
        while (skip < commonPackage.size() && skip < segments.size() && commonPackage.get(skip).equals(segments.get(skip))) {
            skip++;
        }
        StringBuilder sb = new StringBuilder();
        for (String s : segments.subList(skip, segments.size())) {
            sb.append(ExpressionRewriter.snakeCase(s)).append('/');
        }
        return sb.append(fileName(unit)).toString();
    }

    /** Import path from the file at {@code fromTarget} to the file at {@code toTarget}. */
    public static String relativeImport(String fromTarget, String toTarget) {
        List<String> from = new ArrayList<>(Arrays.asList(fromTarget.split("/")));
        from.remove(from.size() - 1);
        List<String> to = Arrays.asList(toTarget.split("/"));
        int common = 0;
        while (common < from.size() && common < to.size() - 1 && from.get(common).equals(to.get(common))) common++;
        StringBuilder sb = new StringBuilder();
        for (int i = common; i < from.size(); i++) sb.append("../");
        sb.append(String.join("/", to.subList(common, to.size())));
        return sb.toString();
    }
}
