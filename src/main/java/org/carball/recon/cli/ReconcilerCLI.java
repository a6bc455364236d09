package org.carball.recon.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.recon.analyzer.ReconciliationOrchestrator;
import org.carball.recon.config.AnalysisSettings;
import org.carball.recon.config.ConfigurationLoader;
import org.carball.recon.config.FieldRegistryLoader;
import org.carball.recon.config.OutputFormat;
import org.carball.recon.config.ReconcilerConfig;
import org.carball.recon.model.analysis.AnalysisReport;
import org.carball.recon.model.field.CanonicalFieldRegistry;
import org.carball.recon.model.table.SourceTable;
import org.carball.recon.output.ReconciliationReport;
import org.carball.recon.output.SchemaDdlGenerator;
import org.carball.recon.parser.CsvTableReader;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

@Slf4j
public class ReconcilerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            Heterogeneous Schema Reconciler v%s             ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    // Consumed by ConfigurationLoader; skipped here together with their value
    private static final Set<String> SETTINGS_OPTIONS = Set.of(
            "--sample-size", "--similarity", "--parallelism", "--core-ratio",
            "--profile-samples", "--categorical-limit");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            ReconcilerConfig config = parseArgs(args);
            if (config.isVerbose()) {
                enableVerboseLogging();
            }

            System.out.println("\n🔍 Starting reconciliation...");
            System.out.println("   Input directory: " + config.getInputDirectory());
            System.out.println("   Field registry: " +
                    (config.getRegistryFile() != null ? config.getRegistryFile() : "built-in"));
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            // Step 1: Load the canonical field registry
            System.out.print("📚 Loading canonical field registry... ");
            FieldRegistryLoader registryLoader = new FieldRegistryLoader();
            CanonicalFieldRegistry registry = config.getRegistryFile() != null ?
                    registryLoader.load(config.getRegistryFile()) :
                    registryLoader.loadDefault();
            System.out.println("✓");

            // Step 2: Enumerate source files
            System.out.print("📂 Enumerating source files... ");
            List<SourceTable> sources = new CsvTableReader().sourcesIn(config.getInputDirectory());
            System.out.println("✓ (" + sources.size() + " files)");

            // Step 3: Reconcile
            System.out.print("📊 Reconciling headers, dates and completeness... ");
            ReconciliationOrchestrator orchestrator =
                    new ReconciliationOrchestrator(registry, config.getAnalysisSettings());
            AnalysisReport report = orchestrator.reconcile(sources);
            System.out.println("✓");

            // Step 4: Output results
            System.out.print("📝 Writing results... ");
            outputResults(report, config);
            System.out.println("✓");

            printSummary(report);

            System.out.println("\n✅ Reconciliation complete!");
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar schema-reconciler.jar <input-directory> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  input-directory     Directory containing the .csv extracts to reconcile");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: reconciliation.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --registry          YAML file with canonical fields and aliases (default: built-in)");
        System.out.println("  --settings          YAML file with analysis settings (optional)");
        System.out.println("  --ddl <table>       Also write a suggested CREATE TABLE for <table> next to the report");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar schema-reconciler.jar ./public_trustees/");
        System.out.println("  java -jar schema-reconciler.jar ./cases/ --registry cases-fields.yml -f both --parallelism 4");
    }

    static ReconcilerConfig parseArgs(String[] args) {
        ReconcilerConfig config = new ReconcilerConfig();
        config.setInputDirectory(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("reconciliation.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        Path settingsFile = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--registry":
                    config.setRegistryFile(Paths.get(requireValue(args, i++, "Field registry file not specified")));
                    break;

                case "--settings":
                    settingsFile = Paths.get(requireValue(args, i++, "Settings file not specified"));
                    break;

                case "--ddl":
                    config.setDdlTableName(requireValue(args, i++, "DDL table name not specified"));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (SETTINGS_OPTIONS.contains(args[i])) {
                        requireValue(args, i, "Value not specified for " + args[i]);
                        i++;
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        AnalysisSettings settings = new ConfigurationLoader().loadSettings(settingsFile, args);
        config.setAnalysisSettings(settings);

        String baseFileName = removeFileExtension(config.getOutputFile());
        switch (config.getOutputFormat()) {
            case MARKDOWN:
                config.setOutputFile(baseFileName + ".md");
                break;
            case BOTH:
            case JSON:
            default:
                config.setOutputFile(baseFileName + ".json");
                break;
        }

        validateConfig(config);

        return config;
    }

    private static String requireValue(String[] args, int optionIndex, String message) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[optionIndex + 1];
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(ReconcilerConfig config) {
        if (!Files.exists(config.getInputDirectory())) {
            throw new IllegalArgumentException("Input directory not found: " + config.getInputDirectory());
        }

        if (!Files.isDirectory(config.getInputDirectory())) {
            throw new IllegalArgumentException("Input path must be a directory");
        }

        if (config.getRegistryFile() != null && !Files.exists(config.getRegistryFile())) {
            throw new IllegalArgumentException("Field registry file not found: " + config.getRegistryFile());
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static void outputResults(AnalysisReport report, ReconcilerConfig config) throws IOException {
        ReconciliationReport rendered = new ReconciliationReport(report);
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), rendered.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), rendered.toMarkdown());
        }

        if (config.getDdlTableName() != null) {
            SchemaDdlGenerator generator = new SchemaDdlGenerator(config.getAnalysisSettings().getCoreFieldRatio());
            Files.writeString(Paths.get(baseFileName + ".sql"), generator.generateDdl(report, config.getDdlTableName()));
        }
    }

    private static void printSummary(AnalysisReport report) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 RECONCILIATION SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nFiles analyzed: " + report.summary().filesAnalyzed());
        System.out.println("Files failed: " + report.summary().filesFailed());
        System.out.printf("Total records: %,d%n", report.summary().totalRows());
        System.out.println("Unique field names: " + report.summary().uniqueNormalizedHeaders());

        System.out.println("\nField mapping coverage:");
        report.fieldMapping().mappings().forEach((field, headers) -> {
            if (!headers.isEmpty()) {
                System.out.printf("  %-25s %d variations%n", field, headers.size());
            }
        });

        if (!report.dateFormatHistogram().isEmpty()) {
            System.out.println("\nDate formats found:");
            report.dateFormatHistogram().forEach((tag, count) ->
                    System.out.printf("  %-25s %d occurrences%n", tag.getLabel(), count));
        }

        if (!report.invalidDateSamples().isEmpty()) {
            System.out.println("\n⚠️  Invalid dates: " + report.invalidDateSamples().size());
        }
        if (!report.multiMappedHeaders().isEmpty()) {
            System.out.println("⚠️  Ambiguous headers: " + report.multiMappedHeaders().keySet());
        }
        if (!report.fileFailures().isEmpty()) {
            System.out.println("\n❌ Files not analyzed:");
            report.fileFailures().forEach(failure ->
                    System.out.println("  - " + failure.fileId() + ": " + failure.reason()));
        }
    }

    private static void enableVerboseLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.recon");
        logger.setLevel(Level.DEBUG);
    }
}
