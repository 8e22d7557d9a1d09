package org.broadinstitute.signatures.tools.signatures;

import org.broadinstitute.signatures.utils.Utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pivots per-sample type-motif counts into a {@link MutationMatrix}; classes without mutations are zero.
 */
public final class MutationMatrixBuilder {

    private MutationMatrixBuilder() {}

    /**
     * @return matrix with one row per aggregate, ordered by sample id.
     */
    public static MutationMatrix build(final List<SampleAggregate> aggregates) {
        Utils.nonNull(aggregates);
        final List<String> columns = SubstitutionClassifier.CANONICAL_MOTIFS;
        final List<MutationMatrix.Row> rows = new ArrayList<>(aggregates.size());
        for (final SampleAggregate aggregate : aggregates) {
            final int[] counts = new int[columns.size()];
            for (int i = 0; i < counts.length; i++) {
                counts[i] = aggregate.getTypeMotifCount(columns.get(i));
            }
            rows.add(new MutationMatrix.Row(aggregate.getSampleId(), counts));
        }
        rows.sort(Comparator.comparing(MutationMatrix.Row::getSampleId));
        return new MutationMatrix(rows);
    }
}
