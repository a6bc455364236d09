package org.carball.recon.model.analysis;

public record RunSummary(
        int filesAnalyzed,
        int filesFailed,
        long totalRows,
        long nonBlankRows,
        int uniqueNormalizedHeaders
) {
}
