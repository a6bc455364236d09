package org.carball.recon.model.analysis;

import org.carball.recon.model.date.DateSample;
import org.carball.recon.model.date.InvalidDateSample;
import org.carball.recon.model.quality.ColumnProfile;
import org.carball.recon.model.quality.FieldCompletenessRecord;

import java.util.List;
import java.util.Map;

/**
 * Partial result of analyzing a single file. Built without touching any shared state, so files
 * can be analyzed in any order or concurrently and folded afterwards.
 *
 * @param normalizedHeaders distinct non-empty normalized headers, in column order
 * @param dateSamples       classified samples per date-bearing normalized header
 * @param invalidDates      every impossible ISO date in the date-bearing columns, not only sampled ones
 * @param columnProfiles    one profile per normalized header, in column order
 */
public record FileAnalysis(
        String fileId,
        FileStatus status,
        List<String> rawHeaders,
        List<String> normalizedHeaders,
        int totalRows,
        int nonBlankRows,
        Map<String, List<DateSample>> dateSamples,
        List<InvalidDateSample> invalidDates,
        List<FieldCompletenessRecord> completeness,
        List<ColumnProfile> columnProfiles,
        String failureReason
) {

    public static FileAnalysis failed(String fileId, String reason) {
        return new FileAnalysis(fileId, FileStatus.FAILED, List.of(), List.of(), 0, 0,
                Map.of(), List.of(), List.of(), List.of(), reason);
    }

    public boolean isAnalyzed() {
        return status == FileStatus.ANALYZED;
    }
}
