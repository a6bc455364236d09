package org.carball.recon.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
