package info.isaksson.erland.composetoflutter;

import info.isaksson.erland.composetoflutter.core.ConversionOptions;
import info.isaksson.erland.composetoflutter.core.ConversionResult;
import info.isaksson.erland.composetoflutter.core.ConversionService;
import info.isaksson.erland.composetoflutter.core.ReportJson;
import info.isaksson.erland.composetoflutter.core.ReportWriter;
import info.isaksson.erland.composetoflutter.core.UnitOutput;
import info.isaksson.erland.composetoflutter.ir.SourceJson;
import info.isaksson.erland.composetoflutter.ir.SourceProject;
import info.isaksson.erland.composetoflutter.ir.UiTreeJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * CLI entrypoint: reads a front-end project JSON, converts it and writes the target files
 * plus a markdown and a JSON report.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final ConversionService SERVICE = new ConversionService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.input == null) {
            System.err.println("Error: --input is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.exists(inputPath) || Files.isDirectory(inputPath)) {
            System.err.println("Error: --input must point to an existing project JSON file: " + inputPath);
            return 1;
        }

        final Path outputRoot = Paths.get(parsed.output).toAbsolutePath().normalize();
        final Path reportOut = resolveReportOutput(parsed.report, outputRoot);
        final Path reportJsonOut = jsonSibling(reportOut);

        final ConversionOptions options;
        try {
            options = parsed.config == null
                    ? new ConversionOptions()
                    : ConversionOptions.read(Paths.get(parsed.config).toAbsolutePath().normalize());
        } catch (IOException e) {
            System.err.println("Error: could not read --config: " + parsed.config);
            System.err.println(e.getMessage());
            return 2;
        }
        applyOverrides(parsed, options);

        final SourceProject project;
        try {
            project = SourceJson.read(inputPath);
        } catch (IOException e) {
            System.err.println("Error: could not read project JSON: " + inputPath);
            System.err.println(e.getMessage());
            return 2;
        }

        final ConversionResult res;
        ExecutorService pool = parsed.threads > 1 ? Executors.newFixedThreadPool(parsed.threads) : null;
        try {
            res = SERVICE.convert(project, options, pool);
        } catch (RuntimeException e) {
            System.err.println("Error: conversion failed.");
            System.err.println(e.getMessage());
            return 2;
        } finally {
            if (pool != null) pool.shutdownNow();
        }

        try {
            for (UnitOutput o : res.outputs) {
                Path target = outputRoot.resolve(o.targetPath);
                Files.createDirectories(target.getParent());
                Files.writeString(target, o.code);
                LOG.debug("Wrote {}", target);
            }
        } catch (IOException e) {
            System.err.println("Error: could not write generated files to: " + outputRoot);
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.writeTree != null) {
            final Path treeOut = resolveTreeOutput(parsed.writeTree);
            try {
                UiTreeJson.write(res.trees, treeOut);
            } catch (IOException e) {
                System.err.println("Error: could not write UI trees to: " + treeOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        try {
            ReportWriter.writeMarkdown(reportOut, inputPath, outputRoot, res.report);
            ReportJson.write(res.report, reportJsonOut);
        } catch (IOException e) {
            System.err.println("Error: could not write report to: " + reportOut);
            System.err.println(e.getMessage());
            return 2;
        }

        System.out.println(
                "compose-to-flutter\n" +
                "- Input: " + inputPath + "\n" +
                "- Output: " + outputRoot + "\n" +
                "- Report: " + reportOut + "\n" +
                "- Units: " + res.report.stats.totalUnits + "\n" +
                "- Converted: " + res.report.stats.convertedUnits + "\n" +
                "- Failed: " + res.report.stats.failedUnits + "\n" +
                "- Cycles: " + res.report.cycles.size() + "\n" +
                "- Warnings: " + res.report.warnings.size()
        );

        // Exit code rules
        if (parsed.failOnError && !res.report.success) {
            System.err.println("Conversion errors present (" + res.report.errors.size() + ") and --fail-on-error is set.");
            System.err.println("See report: " + reportOut);
            return 3;
        }
        return 0;
    }

    private static void applyOverrides(CliArgs parsed, ConversionOptions options) {
        if (parsed.complexityThreshold != null) options.complexityThreshold = parsed.complexityThreshold;
        if (parsed.noSourceComments) options.sourceComments = false;
    }

    private static Path resolveReportOutput(String reportArg, Path outputRoot) {
        if (reportArg != null && !reportArg.isBlank()) {
            return Paths.get(reportArg).toAbsolutePath().normalize();
        }
        return outputRoot.resolve("report.md");
    }

    /** {@code report.md} -> {@code report.json} in the same directory. */
    static Path jsonSibling(Path reportOut) {
        String name = reportOut.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return reportOut.resolveSibling(base + ".json");
    }

    private static Path resolveTreeOutput(String treeArg) {
        if (treeArg.toLowerCase().endsWith(".json")) {
            return Paths.get(treeArg).toAbsolutePath().normalize();
        }
        return Paths.get(treeArg).toAbsolutePath().normalize().resolve("ui-trees.json");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output = "./output";
        String report;
        String config;
        String writeTree;
        Integer complexityThreshold;
        int threads = 1;
        boolean noSourceComments = false;
        boolean failOnError = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--config":
                        out.config = requireValue(args, ++i, "--config");
                        break;
                    case "--write-tree":
                        out.writeTree = requireValue(args, ++i, "--write-tree");
                        break;
                    case "--complexity-threshold":
                        out.complexityThreshold = parseInt(requireValue(args, ++i, "--complexity-threshold"), "--complexity-threshold");
                        break;
                    case "--threads":
                        out.threads = parseInt(requireValue(args, ++i, "--threads"), "--threads");
                        if (out.threads < 1) throw new IllegalArgumentException("--threads must be at least 1");
                        break;
                    case "--no-source-comments":
                        out.noSourceComments = true;
                        break;
                    case "--fail-on-error":
                        out.failOnError = parseBoolean(requireValue(args, ++i, "--fail-on-error"), "--fail-on-error");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --input
                        if (out.input == null) {
                            out.input = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static int parseInt(String v, String flag) {
            try {
                return Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v, e);
            }
        }

        static void printHelp() {
            System.out.println(
                    "compose-to-flutter\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar compose-to-flutter.jar --input <project.json> [--output <dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <file>         Front-end project JSON (required)\n" +
                    "  --output <dir>         Root folder for generated .dart files (default: ./output)\n" +
                    "  --report <file.md>     Markdown report path (default: <output>/report.md).\n" +
                    "                         A JSON report is written next to it.\n" +
                    "  --config <file.json>   Conversion options file (complexityThreshold, widgetMappings,\n" +
                    "                         typeMappings, constConstructors, sourceComments, aiEnabled,\n" +
                    "                         stateManagement, navigation)\n" +
                    "  --write-tree <path>    Also write the extracted UI trees as JSON (file or folder)\n" +
                    "  --complexity-threshold <n>  Flag units above this score for AI-assisted conversion\n" +
                    "                         (default: 20)\n" +
                    "  --threads <n>          Convert units on n worker threads (default: 1)\n" +
                    "  --no-source-comments   Omit the '// Converted from' header\n" +
                    "  --fail-on-error <bool> Exit with code 3 when any unit failed to convert\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/compose-to-flutter.jar --input samples/notes-app/notes-project.json --output out\n" +
                    "  java -jar target/compose-to-flutter.jar samples/notes-app/notes-project.json --write-tree out\n"
            );
        }
    }
}
