package org.broadinstitute.signatures.utils.tsv;

import com.opencsv.CSVReader;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.Utils;
import org.broadinstitute.signatures.utils.io.IOUtils;

import java.io.*;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the contents of a tab separated value formatted text input into
 * records of an arbitrary type {@link R}.
 * <p>
 * Comment lines start with {@link TableUtils#COMMENT_PREFIX} and may appear anywhere.
 * The first non-comment line is the header; every following non-comment line must have
 * as many values as there are columns.
 * </p>
 * <p>
 * Sub-classes implement {@link #createRecord(DataLine)} and may override
 * {@link #processColumns(TableColumnCollection)} to validate the header.
 * </p>
 *
 * @param <R> record type.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    /**
     * Name of the source, {@code null} if unknown.
     */
    private final String source;

    private final LineNumberReader reader;

    private final CSVReader csvReader;

    private TableColumnCollection columns;

    private boolean nextRecordFetched = false;

    private R nextRecord;

    /**
     * Opens a (possibly gzipped) file for reading.
     *
     * @throws IOException if the file could not be opened or the header could not be read.
     */
    public TableReader(final Path path) throws IOException {
        this(Utils.nonNull(path, "the input file cannot be null").toString(), IOUtils.makeReaderMaybeGzipped(path));
    }

    public TableReader(final Reader sourceReader) throws IOException {
        this(null, sourceReader);
    }

    protected TableReader(final String sourceName, final Reader sourceReader) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");
        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        findAndProcessHeaderLine();
    }

    private void findAndProcessHeaderLine() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (!isCommentLine(line)) {
                TableColumnCollection.checkNames(line, this::formatException);
                columns = new TableColumnCollection(line);
                processColumns(columns);
                return;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    protected boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(TableUtils.COMMENT_PREFIX);
    }

    /**
     * Composes a format exception that includes the source and current line number.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d", reader.getLineNumber()) + explanation);
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d", source, reader.getLineNumber()) + explanation);
        }
    }

    /**
     * Called once with the header columns; nothing by default.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
    }

    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    /**
     * @return {@code null} once the input is exhausted.
     */
    public final R readRecord() throws IOException {
        if (!nextRecordFetched) {
            nextRecord = fetchNextRecord();
        }
        nextRecordFetched = false;
        return nextRecord;
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line) || isBlankLine(line)) {
                continue;
            }
            if (line.length != columns.columnCount()) {
                throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
            }
            final R result = createRecord(new DataLine(reader.getLineNumber(), line, columns, this::formatException));
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private static boolean isBlankLine(final String[] line) {
        return line.length == 1 && line[0].trim().isEmpty();
    }

    /**
     * Transforms a data-line into a record; returning {@code null} skips the line.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                fetchIfNeeded();
                return nextRecord != null;
            }

            @Override
            public R next() {
                fetchIfNeeded();
                if (nextRecord == null) {
                    throw new NoSuchElementException("there is no more record in the input");
                }
                nextRecordFetched = false;
                return nextRecord;
            }

            private void fetchIfNeeded() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                }
            }
        };
    }

    public Stream<R> stream() {
        return Utils.stream(this);
    }

    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }

    public String getSource() {
        return source;
    }
}
