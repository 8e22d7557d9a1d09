package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.signatures.utils.tsv.DataLine;
import org.broadinstitute.signatures.utils.tsv.TableColumnCollection;
import org.broadinstitute.signatures.utils.tsv.TableWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Writes a {@link MutationMatrix}: the sample id followed by the 96 classes in canonical order.
 */
public final class MutationMatrixWriter extends TableWriter<MutationMatrix.Row> {

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(ImmutableList.<String>builder()
            .add(MafReader.TUMOR_SAMPLE_BARCODE_COLUMN)
            .addAll(SubstitutionClassifier.CANONICAL_MOTIFS)
            .build());

    public MutationMatrixWriter(final Path path) throws IOException {
        super(path, COLUMNS);
    }

    public MutationMatrixWriter(final Writer writer) {
        super(writer, COLUMNS);
    }

    @Override
    protected void composeLine(final MutationMatrix.Row record, final DataLine dataLine) {
        dataLine.append(record.getSampleId());
        for (final int count : record.getCounts()) {
            dataLine.append(count);
        }
    }
}
