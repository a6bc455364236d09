package org.carball.recon.model.quality;

import java.util.List;

/**
 * Value profile of one normalized field in one file. Values are compared after stripping
 * surrounding whitespace; blank cells are ignored.
 *
 * @param distinctCount     number of distinct non-blank values
 * @param sampleValues      first non-blank values in row order, repeats included
 * @param categoricalValues sorted distinct values, or empty when the column has more distinct
 *                          values than the categorical limit
 */
public record ColumnProfile(
        String fileId,
        String field,
        int distinctCount,
        List<String> sampleValues,
        List<String> categoricalValues
) {

    public ColumnProfile {
        sampleValues = sampleValues == null ? List.of() : List.copyOf(sampleValues);
        categoricalValues = categoricalValues == null ? List.of() : List.copyOf(categoricalValues);
    }

    public boolean isCategorical() {
        return !categoricalValues.isEmpty();
    }
}
