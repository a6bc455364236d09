package org.carball.recon.model.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One source file's header row and data rows as raw string cells.
 * Rows may be shorter than the header row; missing trailing cells read as empty strings.
 */
public record RawTable(List<String> headers, List<List<String>> rows) {

    private static final Pattern BLANK = Pattern.compile("[\\s\\p{Z}]*");
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^[\\s\\p{Z}]+|[\\s\\p{Z}]+$");

    public RawTable {
        headers = copyCells(headers);
        List<List<String>> copiedRows = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                copiedRows.add(copyCells(row));
            }
        }
        rows = Collections.unmodifiableList(copiedRows);
    }

    public int columnCount() {
        return headers.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public String cell(int row, int column) {
        List<String> cells = rows.get(row);
        if (column < 0 || column >= cells.size()) {
            return "";
        }
        return cells.get(column);
    }

    /**
     * True when every cell under a header column is blank. Cells past the header width have no
     * field to be counted against, so content found only there leaves the row blank.
     */
    public boolean isBlankRow(int row) {
        for (int column = 0; column < columnCount(); column++) {
            if (!isBlankCell(cell(row, column))) {
                return false;
            }
        }
        return true;
    }

    public int nonBlankRowCount() {
        int count = 0;
        for (int i = 0; i < rows.size(); i++) {
            if (!isBlankRow(i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Blank means empty or made only of whitespace, Unicode space separators included.
     */
    public static boolean isBlankCell(String cell) {
        return cell == null || BLANK.matcher(cell).matches();
    }

    public static String stripCell(String cell) {
        return cell == null ? "" : EDGE_WHITESPACE.matcher(cell).replaceAll("");
    }

    private static List<String> copyCells(List<String> cells) {
        List<String> copy = new ArrayList<>();
        if (cells != null) {
            for (String cell : cells) {
                copy.add(cell == null ? "" : cell);
            }
        }
        return Collections.unmodifiableList(copy);
    }
}
