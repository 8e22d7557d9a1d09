package org.broadinstitute.signatures.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.signatures.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Class to write tab separated value files.
 * <p>
 * The header line with the column names is written before the first record, or on
 * {@link #close()} if no record was written. Sub-classes fill the values of each
 * record in {@link #composeLine(Object, DataLine)}.
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableWriter<R> implements Closeable {

    private long lineNumber;

    private final CSVWriter writer;

    private final TableColumnCollection columns;

    private boolean headerWritten = false;

    public TableWriter(final Path path, final TableColumnCollection tableColumns) throws IOException {
        this(Files.newBufferedWriter(Utils.nonNull(path, "The path cannot be null."), StandardCharsets.UTF_8), tableColumns);
    }

    public TableWriter(final Writer writer, final TableColumnCollection columns) {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
    }

    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(lineNumber + 1, columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
        lineNumber++;
        if (writer.checkError()) {
            throw new IOException("error writing line " + lineNumber);
        }
    }

    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    public void writeHeaderIfApplies() {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
            lineNumber++;
        }
        headerWritten = true;
    }

    protected abstract void composeLine(final R record, final DataLine dataLine);
}
