package org.carball.recon.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.recon.config.AnalysisSettings;
import org.carball.recon.model.analysis.FileAnalysis;
import org.carball.recon.model.analysis.FileStatus;
import org.carball.recon.model.date.DateSample;
import org.carball.recon.model.date.FormatTag;
import org.carball.recon.model.date.InvalidDateSample;
import org.carball.recon.model.quality.ColumnProfile;
import org.carball.recon.model.quality.FieldCompletenessRecord;
import org.carball.recon.model.table.RawTable;
import org.carball.recon.model.table.SourceTable;
import org.carball.recon.model.table.TableLoadException;
import org.carball.recon.parser.DateFormatClassifier;
import org.carball.recon.parser.HeaderNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Analyzes one source file in isolation. Safe to call concurrently for different files.
 */
@Slf4j
public class FileAnalyzer {

    private final DateFormatClassifier classifier;
    private final CompletenessAggregator completenessAggregator;
    private final ColumnProfiler columnProfiler;
    private final int sampleSize;
    private final List<String> dateKeywords;

    public FileAnalyzer(AnalysisSettings settings) {
        this(settings, new DateFormatClassifier(), new CompletenessAggregator());
    }

    public FileAnalyzer(AnalysisSettings settings,
                        DateFormatClassifier classifier,
                        CompletenessAggregator completenessAggregator) {
        this.classifier = classifier;
        this.completenessAggregator = completenessAggregator;
        this.columnProfiler = new ColumnProfiler(settings.getProfileSampleSize(), settings.getCategoricalLimit());
        this.sampleSize = settings.getDateSampleSize();
        this.dateKeywords = settings.getDateKeywords() == null ? List.of() : settings.getDateKeywords().stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Loads and analyzes the file. A load failure yields a {@link FileStatus#FAILED} result;
     * malformed cells never do.
     */
    public FileAnalysis analyze(SourceTable source) {
        RawTable table;
        try {
            table = source.source().load();
        } catch (TableLoadException e) {
            log.warn("Could not load {}: {}", source.fileId(), e.getMessage());
            return FileAnalysis.failed(source.fileId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected error loading {}: {}", source.fileId(), e.toString());
            log.debug("Load failure details for {}", source.fileId(), e);
            return FileAnalysis.failed(source.fileId(), "Unexpected error: " + e);
        }
        if (table == null) {
            return FileAnalysis.failed(source.fileId(), "Source produced no table");
        }
        return analyze(source.fileId(), table);
    }

    public FileAnalysis analyze(String fileId, RawTable table) {
        Set<String> normalizedHeaders = new LinkedHashSet<>();
        Map<String, List<DateSample>> dateSamples = new LinkedHashMap<>();
        List<InvalidDateSample> invalidDates = new ArrayList<>();

        for (int column = 0; column < table.columnCount(); column++) {
            String header = HeaderNormalizer.normalize(table.headers().get(column));
            if (header.isEmpty()) {
                log.debug("Skipping column {} of {} with empty header", column, fileId);
                continue;
            }
            if (!normalizedHeaders.add(header)) {
                continue;
            }
            if (isDateBearing(header)) {
                dateSamples.put(header, sampleDates(table, column));
                invalidDates.addAll(findInvalidDates(fileId, header, table, column));
            }
        }

        List<FieldCompletenessRecord> completeness = completenessAggregator.computeFieldCompleteness(fileId, table);
        List<ColumnProfile> columnProfiles = columnProfiler.profile(fileId, table);
        int nonBlankRows = table.nonBlankRowCount();

        log.debug("Analyzed {}: {} rows ({} non-blank), {} headers, {} date columns, {} invalid dates",
                fileId, table.rowCount(), nonBlankRows, normalizedHeaders.size(), dateSamples.size(),
                invalidDates.size());

        return new FileAnalysis(
                fileId,
                FileStatus.ANALYZED,
                table.headers(),
                List.copyOf(normalizedHeaders),
                table.rowCount(),
                nonBlankRows,
                dateSamples,
                invalidDates,
                completeness,
                columnProfiles,
                null);
    }

    boolean isDateBearing(String normalizedHeader) {
        return dateKeywords.stream().anyMatch(normalizedHeader::contains);
    }

    private List<DateSample> sampleDates(RawTable table, int column) {
        List<DateSample> samples = new ArrayList<>();
        for (int row = 0; row < table.rowCount() && samples.size() < sampleSize; row++) {
            String value = RawTable.stripCell(table.cell(row, column));
            if (!value.isEmpty()) {
                samples.add(classifier.sample(value));
            }
        }
        return samples;
    }

    /**
     * Checks every value of the column, not only the sampled ones. Rows are 1-based data rows.
     */
    private List<InvalidDateSample> findInvalidDates(String fileId, String header, RawTable table, int column) {
        List<InvalidDateSample> invalid = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            String value = RawTable.stripCell(table.cell(row, column));
            if (value.isEmpty()) {
                continue;
            }
            FormatTag tag = classifier.classify(value);
            if (tag.isSemanticFailure()) {
                invalid.add(new InvalidDateSample(fileId, header, row + 1, value, tag));
            }
        }
        return invalid;
    }
}
