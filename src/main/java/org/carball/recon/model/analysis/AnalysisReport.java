package org.carball.recon.model.analysis;

import org.carball.recon.model.date.FormatTag;
import org.carball.recon.model.date.InvalidDateSample;
import org.carball.recon.model.field.FieldMapping;
import org.carball.recon.model.quality.ColumnProfile;
import org.carball.recon.model.quality.FieldCompletenessRecord;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Terminal artifact of one reconciliation run.
 *
 * @param dateFormatHistogram count per format tag, only tags that occurred
 * @param completeness        per normalized field, records in file-id order
 * @param columnProfiles      per normalized field, profiles in file-id order
 * @param fieldVariations     per normalized header, the sorted ids of files it appeared in
 */
public record AnalysisReport(
        FieldMapping fieldMapping,
        Map<FormatTag, Integer> dateFormatHistogram,
        List<InvalidDateSample> invalidDateSamples,
        Map<String, List<FieldCompletenessRecord>> completeness,
        Map<String, List<ColumnProfile>> columnProfiles,
        List<FileFailure> fileFailures,
        Map<String, List<String>> fieldVariations,
        RunSummary summary
) {

    public List<String> unmappedHeaders() {
        return fieldMapping.unmappedHeaders();
    }

    public Map<String, List<String>> multiMappedHeaders() {
        return fieldMapping.multiMappedHeaders();
    }

    /**
     * Number of distinct files containing at least one header mapped to the given canonical field.
     */
    public int filesContaining(String canonicalField) {
        Set<String> files = new HashSet<>();
        for (String header : fieldMapping.headersFor(canonicalField)) {
            files.addAll(fieldVariations.getOrDefault(header, List.of()));
        }
        return files.size();
    }
}
