package org.carball.recon.model.quality;

import java.util.OptionalDouble;

/**
 * Fill rate of one normalized field in one file. {@code total} counts only rows that are not entirely blank.
 */
public record FieldCompletenessRecord(String fileId, String field, int filled, int total) {

    /**
     * Filled rows as a percentage of non-blank rows, or empty when the file has no non-blank rows.
     */
    public OptionalDouble percentage() {
        if (total == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(filled * 100.0 / total);
    }

    public boolean hasData() {
        return total > 0;
    }
}
