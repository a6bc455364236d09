package org.carball.recon.model.table;

import java.util.Objects;

/**
 * A file identifier paired with the deferred load of its table.
 */
public record SourceTable(String fileId, TableSource source) {

    public SourceTable {
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(source, "source");
    }

    public static SourceTable of(String fileId, RawTable table) {
        return new SourceTable(fileId, () -> table);
    }
}
