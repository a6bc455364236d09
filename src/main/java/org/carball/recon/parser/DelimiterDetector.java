package org.carball.recon.parser;

import java.util.List;

/**
 * Picks the field delimiter of a delimited text file from its header line.
 */
public final class DelimiterDetector {

    static final List<Character> CANDIDATES = List.of(',', ';', '\t', '|');

    private DelimiterDetector() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the candidate occurring most often outside double quotes; comma when none occurs.
     * Ties go to the earlier candidate.
     */
    public static char detect(String headerLine) {
        if (headerLine == null || headerLine.isEmpty()) {
            return ',';
        }
        char best = ',';
        int bestCount = 0;
        for (char candidate : CANDIDATES) {
            int count = countOutsideQuotes(headerLine, candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static int countOutsideQuotes(String line, char delimiter) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == delimiter && !quoted) {
                count++;
            }
        }
        return count;
    }
}
