package org.carball.recon.output;

public final class DdlTemplate {

    private DdlTemplate() {
    }

    public static final String HEADER = """
        -- Suggested schema for %s
        -- Reconciled from %d source files; dates are kept as TEXT and parsed on display
        """;

    public static final String CREATE_TABLE_OPEN = """
        CREATE TABLE IF NOT EXISTS %s (
            id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
            created_at TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
        """;

    public static final String COLUMN = "    %s %s, -- found in %d/%d files\n";

    public static final String OPTIONAL_SECTION = "\n    -- Optional fields (less frequent)\n";

    public static final String METADATA_COLUMNS = """

            -- Import metadata
            file_source TEXT,
            import_batch_id UUID,
            data_quality_score INTEGER DEFAULT 0
        );
        """;

    public static final String INDEX = "CREATE INDEX IF NOT EXISTS idx_%s_%s ON %s(%s);\n";
}
