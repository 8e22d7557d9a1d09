package org.broadinstitute.signatures.tools.signatures;

import org.broadinstitute.signatures.SignaturesBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.broadinstitute.signatures.tools.signatures.SubstitutionRecords.classified;

public final class MutationMatrixBuilderUnitTest extends SignaturesBaseTest {

    @Test
    public void testSingleMutation() {
        final List<SampleAggregate> aggregates = SampleAggregator.aggregate(
                Collections.singletonList(classified("s", 'G', 'A', "TGA", "TGA")));
        final MutationMatrix matrix = MutationMatrixBuilder.build(aggregates);

        Assert.assertEquals(matrix.getRowCount(), 1);
        Assert.assertEquals(matrix.getColumnCount(), 96);
        Assert.assertEquals(matrix.getColumnNames(), SubstitutionClassifier.CANONICAL_MOTIFS);

        final MutationMatrix.Row row = matrix.getRow("s");
        final int column = SubstitutionClassifier.CANONICAL_MOTIFS.indexOf("T[C>T]A");
        for (int i = 0; i < matrix.getColumnCount(); i++) {
            Assert.assertEquals(row.getCount(i), i == column ? 1 : 0, SubstitutionClassifier.CANONICAL_MOTIFS.get(i));
        }
        Assert.assertEquals(row.getCount("T[C>T]A"), 1);
        Assert.assertEquals(row.getTotal(), 1);
    }

    @Test
    public void testRowTotalsMatchMutationCounts() {
        final List<SampleAggregate> aggregates = SampleAggregator.aggregate(Arrays.asList(
                classified("b", 'C', 'T', "TCA", "TCA"),
                classified("a", 'A', 'G', "GAG", "GAG"),
                classified("b", 'T', 'A', "CTC", "CTC"),
                classified("a", 'T', 'C', "CTC", "CTC")));
        final MutationMatrix matrix = MutationMatrixBuilder.build(aggregates);
        Assert.assertEquals(matrix.getRows().get(0).getSampleId(), "a");
        Assert.assertEquals(matrix.getRows().get(1).getSampleId(), "b");
        for (final SampleAggregate aggregate : aggregates) {
            Assert.assertEquals(matrix.getRow(aggregate.getSampleId()).getTotal(), aggregate.getMutationCount());
        }
        Assert.assertEquals(matrix.getRow("a").getCount("G[T>C]G"), 1);
        Assert.assertEquals(matrix.getRow("a").getCount("C[T>C]C"), 1);
        Assert.assertEquals(matrix.getRow("b").getCount("C[T>A]C"), 1);
    }

    @Test
    public void testCountsAreCopied() {
        final MutationMatrix matrix = MutationMatrixBuilder.build(SampleAggregator.aggregate(
                Collections.singletonList(classified("s", 'C', 'T', "TCA", "TCA"))));
        matrix.getRow("s").getCounts()[0] = 100;
        Assert.assertEquals(matrix.getRow("s").getCount(0), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownSample() {
        MutationMatrixBuilder.build(Collections.emptyList()).getRow("missing");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonCanonicalMotif() {
        MutationMatrixBuilder.build(SampleAggregator.aggregate(
                Collections.singletonList(classified("s", 'C', 'T', "TCA", "TCA")))).getRow("s").getCount("T[G>A]A");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRowNeedsAllClasses() {
        new MutationMatrix.Row("s", new int[95]);
    }
}
