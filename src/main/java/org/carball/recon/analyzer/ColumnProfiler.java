package org.carball.recon.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.recon.model.quality.ColumnProfile;
import org.carball.recon.model.table.RawTable;
import org.carball.recon.parser.HeaderNormalizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Distinct-value counts, sample values and small value sets per column of one file.
 */
@Slf4j
public class ColumnProfiler {

    private final int sampleSize;
    private final int categoricalLimit;

    public ColumnProfiler(int sampleSize, int categoricalLimit) {
        this.sampleSize = sampleSize;
        this.categoricalLimit = categoricalLimit;
    }

    /**
     * One profile per column with a non-empty normalized header, in column order. A repeated
     * normalized header is profiled from its first column only.
     */
    public List<ColumnProfile> profile(String fileId, RawTable table) {
        List<ColumnProfile> profiles = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int column = 0; column < table.columnCount(); column++) {
            String field = HeaderNormalizer.normalize(table.headers().get(column));
            if (field.isEmpty() || !seen.add(field)) {
                continue;
            }
            profiles.add(profileColumn(fileId, field, table, column));
        }
        return profiles;
    }

    private ColumnProfile profileColumn(String fileId, String field, RawTable table, int column) {
        List<String> samples = new ArrayList<>();
        TreeSet<String> distinct = new TreeSet<>();
        for (int row = 0; row < table.rowCount(); row++) {
            String value = RawTable.stripCell(table.cell(row, column));
            if (value.isEmpty()) {
                continue;
            }
            if (samples.size() < sampleSize) {
                samples.add(value);
            }
            distinct.add(value);
        }

        boolean categorical = distinct.size() <= categoricalLimit;
        if (!categorical) {
            log.debug("Column '{}' of {} has {} distinct values; value set omitted",
                    field, fileId, distinct.size());
        }
        return new ColumnProfile(fileId, field, distinct.size(), samples,
                categorical ? new ArrayList<>(distinct) : List.of());
    }
}
