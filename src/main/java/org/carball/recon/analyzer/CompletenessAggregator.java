package org.carball.recon.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.recon.model.quality.FieldCompletenessRecord;
import org.carball.recon.model.table.RawTable;
import org.carball.recon.parser.HeaderNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
public class CompletenessAggregator {

    /**
     * One record per column with a non-empty normalized header. Rows that are blank across all
     * header columns count neither as filled nor towards the total. When a normalized header
     * repeats within the file, the first column carrying it is used.
     */
    public List<FieldCompletenessRecord> computeFieldCompleteness(String fileId, RawTable table) {
        List<Integer> nonBlankRows = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            if (!table.isBlankRow(row)) {
                nonBlankRows.add(row);
            }
        }

        List<FieldCompletenessRecord> records = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int column = 0; column < table.columnCount(); column++) {
            String field = HeaderNormalizer.normalize(table.headers().get(column));
            if (field.isEmpty()) {
                continue;
            }
            if (!seen.add(field)) {
                log.debug("Skipping repeated header '{}' in column {} of {}", field, column, fileId);
                continue;
            }

            int filled = 0;
            for (int row : nonBlankRows) {
                if (!RawTable.isBlankCell(table.cell(row, column))) {
                    filled++;
                }
            }
            records.add(new FieldCompletenessRecord(fileId, field, filled, nonBlankRows.size()));
        }
        return records;
    }

    /**
     * Groups records by field. Fields are sorted by name and each field's records by file id;
     * no averaging is done.
     */
    public Map<String, List<FieldCompletenessRecord>> merge(Collection<FieldCompletenessRecord> records) {
        Map<String, List<FieldCompletenessRecord>> byField = new TreeMap<>();
        for (FieldCompletenessRecord record : records) {
            byField.computeIfAbsent(record.field(), f -> new ArrayList<>()).add(record);
        }
        byField.replaceAll((field, list) -> list.stream()
                .sorted(Comparator.comparing(FieldCompletenessRecord::fileId))
                .toList());
        return byField;
    }
}
