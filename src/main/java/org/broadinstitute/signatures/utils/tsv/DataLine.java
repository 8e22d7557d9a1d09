package org.broadinstitute.signatures.utils.tsv;

import org.broadinstitute.signatures.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line.
 * <p>
 * Holds the values of a single row, addressable by column name or index.
 * Readers use it to parse values and writers use it to compose them.
 * </p>
 */
public final class DataLine {

    /**
     * Line number of the row in the source or destination, or -1 if unknown.
     */
    private final long lineNumber;

    private final String[] values;

    private int nextIndex = 0;

    private final TableColumnCollection columns;

    private final Function<String, RuntimeException> formatErrorFactory;

    DataLine(final long lineNumber, final String[] values, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this.lineNumber = lineNumber;
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new data-line with all values undefined.
     */
    public DataLine(final long lineNumber, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(lineNumber, new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    public TableColumnCollection columns() {
        return columns;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * @throws IllegalStateException if any value is still undefined.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    public DataLine set(final String name, final String value) {
        return set(columnIndex(name), value);
    }

    public DataLine set(final String name, final boolean value) {
        return set(name, Boolean.toString(value));
    }

    public DataLine set(final String name, final int value) {
        return set(name, Integer.toString(value));
    }

    public DataLine set(final String name, final long value) {
        return set(name, Long.toString(value));
    }

    /**
     * Sets a double value; not-a-number is written as {@link TableUtils#NOT_AVAILABLE}.
     */
    public DataLine set(final String name, final double value) {
        return set(name, TableUtils.formatDouble(value));
    }

    public DataLine set(final int index, final String value) {
        Utils.validIndex(index, values.length);
        if (index == 0 && value != null && value.startsWith(TableUtils.COMMENT_PREFIX)) {
            throw new IllegalArgumentException("the value of the first column cannot start with the comment prefix: " + TableUtils.COMMENT_PREFIX);
        }
        values[index] = value;
        return this;
    }

    public DataLine append(final String value) {
        if (nextIndex == values.length) {
            throw new IllegalStateException("gone beyond of the end of the data-line");
        }
        return set(nextIndex++, value);
    }

    public DataLine append(final long value) {
        return append(Long.toString(value));
    }

    public DataLine append(final long... values) {
        for (final long l : Utils.nonNull(values, "the values cannot be null")) {
            append(l);
        }
        return this;
    }

    public String get(final int index) {
        Utils.validIndex(index, values.length);
        if (values[index] == null) {
            throw new IllegalStateException("requested column value at " + index + " has not been initialized yet");
        }
        return values[index];
    }

    public String get(final String columnName) {
        return get(columnIndex(columnName));
    }

    /**
     * Returns the value of a column, or a default if the table does not have that column.
     */
    public String get(final String columnName, final String defaultValue) {
        final int index = columns.indexOf(columnName);
        return index < 0 ? defaultValue : values[index];
    }

    public int getInt(final int index) {
        try {
            return Integer.parseInt(get(index).trim());
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected int value for column %s but found %s", columns.nameAt(index), get(index)));
        }
    }

    public int getInt(final String columnName) {
        return getInt(columnIndex(columnName));
    }

    private int columnIndex(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("there is no such a column: " + columnName);
        }
        return index;
    }
}
