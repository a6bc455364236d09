package org.carball.recon.model.table;

/**
 * Raised by a {@link TableSource} when a file cannot be turned into a {@link RawTable} at all.
 */
public class TableLoadException extends Exception {

    public TableLoadException(String message) {
        super(message);
    }

    public TableLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
