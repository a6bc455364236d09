package org.carball.recon.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.recon.model.analysis.AnalysisReport;
import org.carball.recon.model.analysis.FileFailure;
import org.carball.recon.model.analysis.RunSummary;
import org.carball.recon.model.date.FormatTag;
import org.carball.recon.model.date.InvalidDateSample;
import org.carball.recon.model.quality.ColumnProfile;
import org.carball.recon.model.quality.FieldCompletenessRecord;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Renders an {@link AnalysisReport} as JSON or Markdown. Summaries such as mean or worst-file
 * completeness are computed here, never in the analysis itself.
 */
@Slf4j
public class ReconciliationReport {

    private static final int MAX_MARKDOWN_INVALID_DATES = 25;
    private static final int MAX_MARKDOWN_PROFILE_VALUES = 10;

    private final AnalysisReport report;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ReconciliationReport(AnalysisReport report) {
        this(report, LocalDateTime.now());
    }

    ReconciliationReport(AnalysisReport report, LocalDateTime timestamp) {
        this.report = report;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        RunSummary summary = report.summary();

        md.append("# Schema Reconciliation Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Files Analyzed | ").append(summary.filesAnalyzed()).append(" |\n");
        md.append("| Files Failed | ").append(summary.filesFailed()).append(" |\n");
        md.append("| Total Rows | ").append(summary.totalRows()).append(" |\n");
        md.append("| Non-blank Rows | ").append(summary.nonBlankRows()).append(" |\n");
        md.append("| Unique Normalized Headers | ").append(summary.uniqueNormalizedHeaders()).append(" |\n");
        md.append("| Canonical Fields Mapped | ").append(report.fieldMapping().mappedFieldCount())
                .append(" of ").append(report.fieldMapping().mappings().size()).append(" |\n\n");

        md.append("## Field Mapping\n\n");
        md.append("| Canonical Field | Source Headers | Files |\n");
        md.append("|-----------------|----------------|-------|\n");
        report.fieldMapping().mappings().forEach((field, headers) -> {
            String headerList = headers.isEmpty() ? "_not found_" : headers.stream()
                    .map(h -> "`" + h + "`")
                    .collect(Collectors.joining(", "));
            md.append("| ").append(field).append(" | ").append(headerList).append(" | ")
                    .append(report.filesContaining(field)).append(" |\n");
        });
        md.append("\n");

        if (!report.multiMappedHeaders().isEmpty()) {
            md.append("### Ambiguous Headers\n\n");
            md.append("These headers match more than one canonical field and need a decision:\n\n");
            report.multiMappedHeaders().forEach((header, fields) ->
                    md.append("- `").append(header).append("` → ").append(String.join(", ", fields)).append("\n"));
            md.append("\n");
        }

        if (!report.unmappedHeaders().isEmpty()) {
            md.append("### Unmapped Headers\n\n");
            report.unmappedHeaders().forEach(header -> md.append("- `").append(header).append("`\n"));
            md.append("\n");
        }

        md.append("## Date Formats\n\n");
        if (report.dateFormatHistogram().isEmpty()) {
            md.append("No date-bearing columns were found.\n\n");
        } else {
            md.append("| Format | Occurrences |\n");
            md.append("|--------|-------------|\n");
            report.dateFormatHistogram().forEach((tag, count) ->
                    md.append("| ").append(tag.getLabel()).append(" | ").append(count).append(" |\n"));
            md.append("\n");
        }

        if (!report.invalidDateSamples().isEmpty()) {
            md.append("### Invalid Dates\n\n");
            md.append("| File | Row | Field | Value | Reason |\n");
            md.append("|------|-----|-------|-------|--------|\n");
            report.invalidDateSamples().stream()
                    .limit(MAX_MARKDOWN_INVALID_DATES)
                    .forEach(sample -> md.append("| ").append(sample.fileId())
                            .append(" | ").append(sample.row())
                            .append(" | ").append(sample.field())
                            .append(" | `").append(sample.rawValue()).append("`")
                            .append(" | ").append(sample.reason().getLabel()).append(" |\n"));
            if (report.invalidDateSamples().size() > MAX_MARKDOWN_INVALID_DATES) {
                md.append("\n... and ").append(report.invalidDateSamples().size() - MAX_MARKDOWN_INVALID_DATES)
                        .append(" more\n");
            }
            md.append("\n");
        }

        md.append("## Field Completeness\n\n");
        md.append("| Field | Files | Mean | Worst File |\n");
        md.append("|-------|-------|------|------------|\n");
        report.completeness().forEach((field, records) -> {
            md.append("| ").append(field).append(" | ").append(records.size()).append(" | ");
            OptionalDouble mean = meanCompleteness(records);
            md.append(mean.isPresent() ? String.format("%.1f%%", mean.getAsDouble()) : "no data").append(" | ");
            md.append(worstFile(records)
                    .map(r -> String.format("%s (%.1f%%)", r.fileId(), r.percentage().getAsDouble()))
                    .orElse("-"))
                    .append(" |\n");
        });
        md.append("\n");

        if (!report.columnProfiles().isEmpty()) {
            md.append("## Column Profiles\n\n");
            md.append("| Field | File | Distinct | Values |\n");
            md.append("|-------|------|----------|--------|\n");
            report.columnProfiles().forEach((field, profiles) -> profiles.forEach(profile ->
                    md.append("| ").append(field)
                            .append(" | ").append(profile.fileId())
                            .append(" | ").append(profile.distinctCount())
                            .append(" | ").append(describeValues(profile)).append(" |\n")));
            md.append("\n");
        }

        if (!report.fileFailures().isEmpty()) {
            md.append("## Files Not Analyzed\n\n");
            for (FileFailure failure : report.fileFailures()) {
                md.append("- **").append(failure.fileId()).append("**: ").append(failure.reason()).append("\n");
            }
            md.append("\n");
        }

        md.append("---\n\n");
        md.append("*Generated by Schema Reconciler*\n");

        return md.toString();
    }

    static OptionalDouble meanCompleteness(List<FieldCompletenessRecord> records) {
        return records.stream()
                .filter(FieldCompletenessRecord::hasData)
                .mapToDouble(r -> r.percentage().getAsDouble())
                .average();
    }

    static Optional<FieldCompletenessRecord> worstFile(List<FieldCompletenessRecord> records) {
        return records.stream()
                .filter(FieldCompletenessRecord::hasData)
                .min(Comparator.comparingDouble(r -> r.percentage().getAsDouble()));
    }

    /**
     * Categorical columns list their value set; other columns show their first samples.
     */
    static String describeValues(ColumnProfile profile) {
        List<String> values = profile.isCategorical() ? profile.categoricalValues() : profile.sampleValues();
        if (values.isEmpty()) {
            return "-";
        }
        String shown = values.stream()
                .limit(MAX_MARKDOWN_PROFILE_VALUES)
                .map(v -> "`" + v.replace("|", "\\|") + "`")
                .collect(Collectors.joining(", "));
        if (values.size() > MAX_MARKDOWN_PROFILE_VALUES) {
            shown += ", ...";
        }
        return profile.isCategorical() ? shown : "e.g. " + shown;
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();
        RunSummary summary = report.summary();

        data.setMetadata(new ReportMetadata(
                timestamp,
                summary.filesAnalyzed(),
                summary.filesFailed(),
                summary.totalRows(),
                summary.nonBlankRows(),
                summary.uniqueNormalizedHeaders()
        ));

        data.setFieldMapping(report.fieldMapping().mappings());
        data.setUnmappedHeaders(report.unmappedHeaders());
        data.setMultiMappedHeaders(report.multiMappedHeaders());

        Map<String, Integer> histogram = new LinkedHashMap<>();
        for (Map.Entry<FormatTag, Integer> entry : report.dateFormatHistogram().entrySet()) {
            histogram.put(entry.getKey().getLabel(), entry.getValue());
        }
        data.setDateFormatHistogram(histogram);

        data.setInvalidDateSamples(report.invalidDateSamples().stream()
                .map(ReconciliationReport::toInvalidDate)
                .collect(Collectors.toList()));

        Map<String, List<CompletenessEntry>> completeness = new LinkedHashMap<>();
        report.completeness().forEach((field, records) -> completeness.put(field, records.stream()
                .map(ReconciliationReport::toCompletenessEntry)
                .collect(Collectors.toList())));
        data.setCompleteness(completeness);

        Map<String, List<ProfileEntry>> profiles = new LinkedHashMap<>();
        report.columnProfiles().forEach((field, list) -> profiles.put(field, list.stream()
                .map(ReconciliationReport::toProfileEntry)
                .collect(Collectors.toList())));
        data.setColumnProfiles(profiles);

        data.setFileFailures(report.fileFailures());
        data.setFieldVariations(report.fieldVariations());

        return data;
    }

    private static InvalidDate toInvalidDate(InvalidDateSample sample) {
        InvalidDate invalid = new InvalidDate();
        invalid.setFile(sample.fileId());
        invalid.setField(sample.field());
        invalid.setRow(sample.row());
        invalid.setValue(sample.rawValue());
        invalid.setReason(sample.reason().getLabel());
        return invalid;
    }

    private static CompletenessEntry toCompletenessEntry(FieldCompletenessRecord record) {
        CompletenessEntry entry = new CompletenessEntry();
        entry.setFile(record.fileId());
        entry.setFilled(record.filled());
        entry.setTotal(record.total());
        OptionalDouble percentage = record.percentage();
        entry.setPercentage(percentage.isPresent() ? percentage.getAsDouble() : null);
        return entry;
    }

    private static ProfileEntry toProfileEntry(ColumnProfile profile) {
        ProfileEntry entry = new ProfileEntry();
        entry.setFile(profile.fileId());
        entry.setDistinctCount(profile.distinctCount());
        entry.setSampleValues(profile.sampleValues());
        entry.setCategoricalValues(profile.isCategorical() ? profile.categoricalValues() : null);
        return entry;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private Map<String, List<String>> fieldMapping;
        private List<String> unmappedHeaders;
        private Map<String, List<String>> multiMappedHeaders;
        private Map<String, Integer> dateFormatHistogram;
        private List<InvalidDate> invalidDateSamples;
        private Map<String, List<CompletenessEntry>> completeness;
        private Map<String, List<ProfileEntry>> columnProfiles;
        private List<FileFailure> fileFailures;
        private Map<String, List<String>> fieldVariations;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private int filesAnalyzed;
        private int filesFailed;
        private long totalRows;
        private long nonBlankRows;
        private int uniqueNormalizedHeaders;
    }

    @lombok.Data
    private static class InvalidDate {
        private String file;
        private String field;
        private int row;
        private String value;
        private String reason;
    }

    @lombok.Data
    private static class CompletenessEntry {
        private String file;
        private int filled;
        private int total;
        private Double percentage;
    }

    @lombok.Data
    private static class ProfileEntry {
        private String file;
        private int distinctCount;
        private List<String> sampleValues;
        private List<String> categoricalValues;
    }
}
