package org.broadinstitute.signatures.utils.tsv;

/**
 * Common constants for table readers and writers, and value formatting.
 */
public final class TableUtils {

    /**
     * Column separator {@value #COLUMN_SEPARATOR_STRING}.
     */
    public static final char COLUMN_SEPARATOR = '\t';

    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    /**
     * Lines that start with this prefix (spaces are not ignored) are comment lines,
     * neither a header line nor a data line.
     */
    public static final String COMMENT_PREFIX = "#";

    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Within quotes this character must precede a literal quote or escape character.
     */
    public static final char ESCAPE_CHARACTER = '\\';

    /**
     * Value written for undefined (not-a-number) table cells.
     */
    public static final String NOT_AVAILABLE = "NA";

    private TableUtils() { }

    /**
     * Formats a double for output, rendering not-a-number as {@value #NOT_AVAILABLE}.
     */
    public static String formatDouble(final double value) {
        return Double.isNaN(value) ? NOT_AVAILABLE : Double.toString(value);
    }
}
