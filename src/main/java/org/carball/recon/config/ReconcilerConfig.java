package org.carball.recon.config;

import lombok.Data;
import java.nio.file.Path;

@Data
public class ReconcilerConfig {
    private Path inputDirectory;
    private String outputFile;
    private OutputFormat outputFormat;
    private Path registryFile;
    private AnalysisSettings analysisSettings;
    private String ddlTableName;
    private boolean verbose;
}
