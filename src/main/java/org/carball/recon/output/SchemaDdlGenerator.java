package org.carball.recon.output;

import org.carball.recon.model.analysis.AnalysisReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Suggests a {@code CREATE TABLE} statement for the canonical fields that were found in the sources.
 * Fields present in at least the core ratio of analyzed files are listed first.
 */
public class SchemaDdlGenerator {

    private static final Set<String> INTEGER_FIELDS = Set.of("file_year", "serial_number");

    private final double coreFieldRatio;

    public SchemaDdlGenerator(double coreFieldRatio) {
        this.coreFieldRatio = coreFieldRatio;
    }

    public String generateDdl(AnalysisReport report, String tableName) {
        String table = sanitizeIdentifier(tableName);
        int totalFiles = report.summary().filesAnalyzed();

        List<String> coreColumns = new ArrayList<>();
        List<String> optionalColumns = new ArrayList<>();

        report.fieldMapping().mappings().forEach((field, headers) -> {
            if (headers.isEmpty()) {
                return;
            }
            int files = report.filesContaining(field);
            String column = String.format(DdlTemplate.COLUMN, sanitizeIdentifier(field), sqlType(field), files, totalFiles);
            if (totalFiles > 0 && files >= totalFiles * coreFieldRatio) {
                coreColumns.add(column);
            } else {
                optionalColumns.add(column);
            }
        });

        StringBuilder ddl = new StringBuilder();
        ddl.append(String.format(DdlTemplate.HEADER, table, totalFiles));
        ddl.append("\n");
        ddl.append(String.format(DdlTemplate.CREATE_TABLE_OPEN, table));
        coreColumns.forEach(ddl::append);
        if (!optionalColumns.isEmpty()) {
            ddl.append(DdlTemplate.OPTIONAL_SECTION);
            optionalColumns.forEach(ddl::append);
        }
        ddl.append(DdlTemplate.METADATA_COLUMNS);
        ddl.append("\n");
        ddl.append(String.format(DdlTemplate.INDEX, table, "file_source", table, "file_source"));

        return ddl.toString();
    }

    String sqlType(String canonicalField) {
        if (INTEGER_FIELDS.contains(canonicalField)) {
            return "INTEGER";
        }
        return "TEXT";
    }

    static String sanitizeIdentifier(String name) {
        String sanitized = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "_");
        sanitized = sanitized.replaceAll("_+", "_").replaceAll("^_|_$", "");
        if (sanitized.isEmpty()) {
            return "reconciled_records";
        }
        if (Character.isDigit(sanitized.charAt(0))) {
            return "t_" + sanitized;
        }
        return sanitized;
    }
}
