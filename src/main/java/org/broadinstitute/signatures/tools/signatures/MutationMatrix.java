package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.signatures.utils.Utils;

import java.util.Arrays;
import java.util.List;

/**
 * Sample by 96-class count matrix. Columns follow {@link SubstitutionClassifier#CANONICAL_MOTIFS}.
 */
public final class MutationMatrix {

    private final List<Row> rows;

    public MutationMatrix(final List<Row> rows) {
        this.rows = ImmutableList.copyOf(Utils.nonNull(rows));
    }

    /**
     * Counts of one sample.
     */
    public static final class Row {
        private final String sampleId;
        private final int[] counts;

        public Row(final String sampleId, final int[] counts) {
            this.sampleId = Utils.nonNull(sampleId);
            Utils.nonNull(counts);
            Utils.validateArg(counts.length == SubstitutionClassifier.CANONICAL_MOTIFS.size(),
                    () -> "expected " + SubstitutionClassifier.CANONICAL_MOTIFS.size() + " counts but got " + counts.length);
            this.counts = counts.clone();
        }

        public String getSampleId() {
            return sampleId;
        }

        public int getCount(final int column) {
            return counts[Utils.validIndex(column, counts.length)];
        }

        public int getCount(final String motif) {
            final int column = SubstitutionClassifier.CANONICAL_MOTIFS.indexOf(motif);
            Utils.validateArg(column >= 0, () -> "not a canonical motif: " + motif);
            return counts[column];
        }

        public int[] getCounts() {
            return counts.clone();
        }

        public int getTotal() {
            return Arrays.stream(counts).sum();
        }
    }

    public List<Row> getRows() {
        return rows;
    }

    public List<String> getColumnNames() {
        return SubstitutionClassifier.CANONICAL_MOTIFS;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return SubstitutionClassifier.CANONICAL_MOTIFS.size();
    }

    /**
     * @throws IllegalArgumentException if there is no such sample.
     */
    public Row getRow(final String sampleId) {
        return rows.stream()
                .filter(r -> r.getSampleId().equals(sampleId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("no such sample: " + sampleId));
    }
}
