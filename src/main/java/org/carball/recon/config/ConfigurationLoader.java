package org.carball.recon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > settings file > defaults
     */
    public AnalysisSettings loadSettings(Path settingsFile, String[] args) {
        log.debug("Loading analysis settings");

        AnalysisSettings base = settingsFile == null ? AnalysisSettings.createDefaults() : readSettingsFile(settingsFile);
        AnalysisSettings.AnalysisSettingsBuilder builder = base.toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        AnalysisSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getDescription());
        return settings;
    }

    /**
     * Reads a YAML settings file. Keys left out of the file keep their defaults.
     */
    public AnalysisSettings readSettingsFile(Path settingsFile) {
        if (!Files.exists(settingsFile)) {
            throw new IllegalArgumentException("Settings file not found: " + settingsFile);
        }
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            AnalysisSettings settings = mapper.readValue(settingsFile.toFile(), AnalysisSettings.class);
            log.info("Loaded analysis settings from: {}", settingsFile);
            return settings;
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file " + settingsFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(AnalysisSettings.AnalysisSettingsBuilder builder) {
        applyEnvironmentValue(builder, "RECON_DATE_SAMPLE_SIZE", "--sample-size");
        applyEnvironmentValue(builder, "RECON_SIMILARITY_THRESHOLD", "--similarity");
        applyEnvironmentValue(builder, "RECON_PARALLELISM", "--parallelism");
        applyEnvironmentValue(builder, "RECON_CORE_FIELD_RATIO", "--core-ratio");
        applyEnvironmentValue(builder, "RECON_PROFILE_SAMPLE_SIZE", "--profile-samples");
        applyEnvironmentValue(builder, "RECON_CATEGORICAL_LIMIT", "--categorical-limit");
    }

    private void applyEnvironmentValue(AnalysisSettings.AnalysisSettingsBuilder builder, String variable, String option) {
        String value = environment.get(variable);
        if (value != null) {
            applyOption(builder, option, value, variable);
        }
    }

    private void applyCLIArguments(AnalysisSettings.AnalysisSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            applyOption(builder, args[i], args[i + 1], args[i]);
        }
    }

    private void applyOption(AnalysisSettings.AnalysisSettingsBuilder builder, String option, String value, String source) {
        try {
            switch (option) {
                case "--sample-size":
                    builder.dateSampleSize(Integer.parseInt(value.trim()));
                    break;
                case "--similarity":
                    builder.similarityThreshold(Double.parseDouble(value.trim()));
                    break;
                case "--parallelism":
                    builder.parallelism(Integer.parseInt(value.trim()));
                    break;
                case "--core-ratio":
                    builder.coreFieldRatio(Double.parseDouble(value.trim()));
                    break;
                case "--profile-samples":
                    builder.profileSampleSize(Integer.parseInt(value.trim()));
                    break;
                case "--categorical-limit":
                    builder.categoricalLimit(Integer.parseInt(value.trim()));
                    break;
                default:
                    break;
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for analysis setting options.
     */
    public static String getSettingsHelp() {
        return """
            Analysis Settings:

            CLI Arguments:
              --sample-size <num>     Values classified per date-bearing column (default: 10)
              --similarity <num>      Token-overlap threshold for fuzzy header matches (default: 0.7)
              --parallelism <num>     Files analyzed concurrently; 1 is sequential (default: 1)
              --core-ratio <num>      Share of files a field needs to be a core DDL column (default: 0.5)
              --profile-samples <num> Sample values kept per column profile (default: 10)
              --categorical-limit <n> Most distinct values for which a column lists its value set (default: 50)

            Environment Variables:
              RECON_DATE_SAMPLE_SIZE       Same as --sample-size
              RECON_SIMILARITY_THRESHOLD   Same as --similarity
              RECON_PARALLELISM            Same as --parallelism
              RECON_CORE_FIELD_RATIO       Same as --core-ratio
              RECON_PROFILE_SAMPLE_SIZE    Same as --profile-samples
              RECON_CATEGORICAL_LIMIT      Same as --categorical-limit

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file (--settings)
              4. Built-in defaults
            """;
    }
}
