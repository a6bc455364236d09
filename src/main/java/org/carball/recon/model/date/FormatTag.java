package org.carball.recon.model.date;

/**
 * Classification labels for date-like strings. Declaration order is the classifier's priority order
 * for the syntactic patterns; the two ISO failure variants are only reached through {@link #ISO_DATE}.
 */
public enum FormatTag {
    SLASH_NUMERIC("slash_numeric"),
    DASH_NUMERIC("dash_numeric"),
    DOT_NUMERIC("dot_numeric"),
    ISO_DATE("iso_date"),
    ISO_DATE_INVALID_RANGE("iso_date_invalid_range"),
    ISO_DATE_MALFORMED("iso_date_malformed"),
    TEXTUAL_LONG("textual_long"),
    DAY_MONTH_TEXT_YEAR("day_month_text_year"),
    MONTH_TEXT_DAY_YEAR("month_text_day_year"),
    INCOMPLETE("incomplete"),
    MALFORMED_MULTI_PART("malformed_multi_part"),
    UNKNOWN("unknown");

    private final String label;

    FormatTag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSemanticFailure() {
        return this == ISO_DATE_INVALID_RANGE || this == ISO_DATE_MALFORMED;
    }
}
