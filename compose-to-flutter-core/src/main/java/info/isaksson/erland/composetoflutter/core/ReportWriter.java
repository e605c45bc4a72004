package info.isaksson.erland.composetoflutter.core;

import info.isaksson.erland.composetoflutter.emitter.GenerationWarning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Human-readable markdown report. */
public final class ReportWriter {

    private ReportWriter() {}

    public static void writeMarkdown(Path reportPath, Path inputPath, Path outputRoot, ConversionReport report) throws IOException {
        if (reportPath == null) throw new IllegalArgumentException("reportPath must not be null");
        Path parent = reportPath.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportPath, toMarkdown(inputPath, outputRoot, report));
    }

    public static String toMarkdown(Path inputPath, Path outputRoot, ConversionReport report) {
        if (report == null) throw new IllegalArgumentException("report must not be null");
        ConversionReport.Stats s = report.stats;

        StringBuilder md = new StringBuilder();
        md.append("# compose-to-flutter report\n\n");

        md.append("## Summary\n\n");
        md.append("- Project: `").append(report.projectName).append("`\n");
        if (inputPath != null) md.append("- Input: `").append(inputPath).append("`\n");
        if (outputRoot != null) md.append("- Output: `").append(outputRoot).append("`\n");
        md.append("- Success: **").append(report.success).append("**\n");
        md.append("- Units: **").append(s.totalUnits).append("**\n");
        md.append("- Converted: **").append(s.convertedUnits).append("**\n");
        md.append("- Failed: **").append(s.failedUnits).append("**\n");
        md.append("- AI-assisted: **").append(s.aiAssistedUnits).append("**\n");
        md.append("- Components: **").append(s.components).append("**\n");
        md.append("- Source lines: **").append(s.sourceLines).append("**\n");
        md.append("- Generated lines: **").append(s.generatedLines).append("**\n");
        md.append("- Warnings: **").append(s.warnings).append("**\n\n");

        md.append("## Conversion order\n\n");
        if (report.units.isEmpty()) {
            md.append("_(none)_\n");
        } else {
            md.append("| # | Unit | Target | Priority | Complexity | Shape | Method |\n");
            md.append("|---:|---|---|---|---:|---|---|\n");
            int i = 1;
            for (ConversionReport.UnitSummary u : report.units) {
                md.append("| ").append(i++)
                        .append(" | `").append(u.unitPath)
                        .append("` | `").append(u.targetPath)
                        .append("` | ").append(u.priority)
                        .append(" | ").append(u.complexity)
                        .append(" | ").append(u.shape)
                        .append(" | ").append(u.generationMethod)
                        .append(" |\n");
            }
        }

        md.append("\n## Dependency cycles\n\n");
        if (report.cycles.isEmpty()) {
            md.append("_(none)_\n");
        } else {
            for (List<String> cycle : report.cycles) {
                md.append("- ").append(String.join(" -> ", cycle)).append("\n");
            }
        }

        md.append("\n## Complexity\n\n");
        if (report.complexity.isEmpty()) {
            md.append("_(none)_\n");
        } else {
            for (Map.Entry<String, Integer> e : report.complexity.entrySet()) {
                md.append("- `").append(e.getKey()).append("`: ").append(e.getValue()).append("\n");
            }
        }

        md.append("\n## Errors\n\n");
        if (report.errors.isEmpty()) {
            md.append("_(none)_\n");
        } else {
            for (ConversionError e : report.errors) {
                md.append("- ").append(e.code).append(" `").append(e.unitPath).append("`: ").append(e.message).append("\n");
            }
        }

        md.append("\n## Warnings\n\n");
        if (report.warnings.isEmpty()) {
            md.append("_(none)_\n");
        } else {
            for (GenerationWarning w : report.warnings) {
                md.append("- ").append(w.code).append(": ").append(w.message);
                if (!w.context.isEmpty()) md.append(" ").append(w.context);
                md.append("\n");
            }
        }
        return md.toString();
    }
}
