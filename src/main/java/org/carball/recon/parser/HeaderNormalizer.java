package org.carball.recon.parser;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw column names into a comparable form.
 * <p>
 * Diacritics are decomposed into combining marks but kept, so a normalized value must only be
 * compared against another normalized value. Unicode space separators such as U+00A0 and U+3000
 * count as whitespace.
 */
public final class HeaderNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\p{Z}]+");

    private HeaderNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the normalized form of {@code raw}; an empty result means "no header".
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        // NFD maps some space separators onto others, so collapse afterwards
        String text = Normalizer.normalize(raw, Normalizer.Form.NFD);
        text = WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();
        return text.toLowerCase(Locale.ROOT);
    }
}
