package org.carball.recon.analyzer;

import org.carball.recon.model.analysis.AnalysisReport;
import org.carball.recon.model.analysis.FileAnalysis;
import org.carball.recon.model.analysis.FileFailure;
import org.carball.recon.model.analysis.RunSummary;
import org.carball.recon.model.date.DateSample;
import org.carball.recon.model.date.FormatTag;
import org.carball.recon.model.date.InvalidDateSample;
import org.carball.recon.model.field.FieldMapping;
import org.carball.recon.model.quality.ColumnProfile;
import org.carball.recon.model.quality.FieldCompletenessRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Run-wide state built by folding per-file partial results one at a time.
 * Not thread-safe: folding is the single-threaded step of a run. Per-field lists keep fold order,
 * which the orchestrator makes file-id order.
 */
public class AnalysisAccumulator {

    private final Map<String, Set<String>> fieldVariations = new TreeMap<>();
    private final Map<FormatTag, Integer> dateFormatHistogram = new EnumMap<>(FormatTag.class);
    private final List<InvalidDateSample> invalidDateSamples = new ArrayList<>();
    private final List<FieldCompletenessRecord> completenessRecords = new ArrayList<>();
    private final Map<String, List<ColumnProfile>> columnProfiles = new TreeMap<>();
    private final List<FileFailure> fileFailures = new ArrayList<>();
    private int filesAnalyzed;
    private long totalRows;
    private long nonBlankRows;

    public void fold(FileAnalysis analysis) {
        if (!analysis.isAnalyzed()) {
            fileFailures.add(new FileFailure(analysis.fileId(), analysis.failureReason()));
            return;
        }

        filesAnalyzed++;
        totalRows += analysis.totalRows();
        nonBlankRows += analysis.nonBlankRows();

        for (String header : analysis.normalizedHeaders()) {
            fieldVariations.computeIfAbsent(header, h -> new TreeSet<>()).add(analysis.fileId());
        }

        for (List<DateSample> samples : analysis.dateSamples().values()) {
            for (DateSample sample : samples) {
                dateFormatHistogram.merge(sample.tag(), 1, Integer::sum);
            }
        }
        invalidDateSamples.addAll(analysis.invalidDates());

        completenessRecords.addAll(analysis.completeness());
        for (ColumnProfile profile : analysis.columnProfiles()) {
            columnProfiles.computeIfAbsent(profile.field(), f -> new ArrayList<>()).add(profile);
        }
    }

    public Set<String> normalizedHeaders() {
        return Collections.unmodifiableSet(fieldVariations.keySet());
    }

    public List<FieldCompletenessRecord> completenessRecords() {
        return Collections.unmodifiableList(completenessRecords);
    }

    public AnalysisReport toReport(FieldMapping fieldMapping,
                                   Map<String, List<FieldCompletenessRecord>> completeness) {
        Map<String, List<String>> variations = new LinkedHashMap<>();
        fieldVariations.forEach((header, files) -> variations.put(header, List.copyOf(files)));
        Map<String, List<ColumnProfile>> profiles = new LinkedHashMap<>();
        columnProfiles.forEach((field, list) -> profiles.put(field, List.copyOf(list)));

        RunSummary summary = new RunSummary(
                filesAnalyzed,
                fileFailures.size(),
                totalRows,
                nonBlankRows,
                fieldVariations.size());

        return new AnalysisReport(
                fieldMapping,
                Collections.unmodifiableMap(new EnumMap<>(dateFormatHistogram)),
                List.copyOf(invalidDateSamples),
                Collections.unmodifiableMap(completeness),
                Collections.unmodifiableMap(profiles),
                List.copyOf(fileFailures),
                Collections.unmodifiableMap(variations),
                summary);
    }
}
