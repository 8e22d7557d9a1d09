package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.signatures.SignaturesBaseTest;
import org.broadinstitute.signatures.engine.ReferenceDataSource;
import org.broadinstitute.signatures.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.File;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class TrinucleotideMatrixEngineUnitTest extends SignaturesBaseTest {

    private static final double TOLERANCE = 1e-6;

    private ReferenceDataSource reference;
    private List<MafVariant> variants;

    @BeforeClass
    public void openReference() {
        reference = ReferenceDataSource.of(Paths.get(trinucleotideReference));
        variants = MafReader.read(new File(getToolTestDataDir(), "two_samples.maf").toPath());
    }

    @AfterClass(alwaysRun = true)
    public void closeReference() {
        reference.close();
    }

    @Test
    public void testMatrix() {
        final TrinucleotideMatrixResult result = new TrinucleotideMatrixEngine(reference).run(variants);
        final MutationMatrix matrix = result.getMatrix();
        Assert.assertEquals(matrix.getRows().stream().map(MutationMatrix.Row::getSampleId).collect(Collectors.toList()),
                Arrays.asList("SAMPLE_X", "SAMPLE_Y"));
        Assert.assertEquals(matrix.getRow("SAMPLE_X").getCount("T[C>T]A"), 3);
        Assert.assertEquals(matrix.getRow("SAMPLE_X").getTotal(), 3);
        // A>G on GAG is T>C with the flanks kept
        Assert.assertEquals(matrix.getRow("SAMPLE_Y").getCount("G[T>C]G"), 3);
        Assert.assertEquals(matrix.getRow("SAMPLE_Y").getTotal(), 3);
    }

    @Test
    public void testEnrichment() {
        final TrinucleotideMatrixResult result = new TrinucleotideMatrixEngine(reference).run(variants);
        Assert.assertEquals(result.getEnrichment().stream().map(ApobecEnrichmentResult::getSampleId).collect(Collectors.toList()),
                Arrays.asList("SAMPLE_X", "SAMPLE_Y"));

        final ApobecEnrichmentResult x = result.getEnrichment("SAMPLE_X");
        Assert.assertEquals(x.getAggregate().getBackground(), new BackgroundComposition(42, 16, 43, 22, 5, 0, 2, 1));
        Assert.assertEquals(x.getEnrichmentRatio(), 3.2, TOLERANCE);
        Assert.assertEquals(x.getPValue(), 0.3092437, TOLERANCE);
        Assert.assertEquals(x.getOddsRatio(), Double.POSITIVE_INFINITY);
        Assert.assertEquals(x.getConfidenceIntervalLow(), 0.2673581, TOLERANCE);
        Assert.assertTrue(x.isEnriched());

        final ApobecEnrichmentResult y = result.getEnrichment("SAMPLE_Y");
        Assert.assertEquals(y.getAggregate().getBackground().getC(), 15);
        Assert.assertEquals(y.getAggregate().getBackground().getTcw(), 0);
        Assert.assertEquals(y.getAggregate().getBackground().getWga(), 20);
        Assert.assertTrue(Double.isNaN(y.getEnrichmentRatio()));
        Assert.assertFalse(y.isTestDefined());
        Assert.assertFalse(y.isEnriched());
    }

    @Test
    public void testDiagnostics() {
        final TrinucleotideMatrixDiagnostics diagnostics = new TrinucleotideMatrixEngine(reference).run(variants).getDiagnostics();
        Assert.assertEquals(diagnostics.getContigMismatch().getDroppedContigs(), Collections.singleton("chr3"));
        Assert.assertEquals(diagnostics.getContigMismatch().getDroppedVariantCount(), 1);
        Assert.assertTrue(diagnostics.getContextIntegrityWarnings().isEmpty());
        Assert.assertTrue(diagnostics.hasWarnings());
    }

    @Test
    public void testWithoutSilentVariants() {
        final TrinucleotideMatrixEngine engine = new TrinucleotideMatrixEngine(
                new VariantPreparer(false, Collections.emptyList(), null, VariantPreparer.PrefixMode.ADD),
                new ContextExtractor(reference), new ApobecEnrichmentScorer());
        final TrinucleotideMatrixResult result = engine.run(variants);
        Assert.assertEquals(result.getMatrix().getRow("SAMPLE_X").getCount("T[C>T]A"), 2);
        Assert.assertEquals(result.getMatrix().getRow("SAMPLE_Y").getCount("G[T>C]G"), 2);

        final ApobecEnrichmentResult x = result.getEnrichment("SAMPLE_X");
        Assert.assertEquals(x.getAggregate().getBackground().getC(), 11);
        Assert.assertEquals(x.getAggregate().getBackground().getTcw(), 3);
        // (2 / 2) / (3 / 11)
        Assert.assertEquals(x.getEnrichmentRatio(), 11.0 / 3.0, TOLERANCE);
        Assert.assertEquals(x.getPValue(), 0.4347826, TOLERANCE);
    }

    @Test
    public void testSmallerBackgroundWindow() {
        final TrinucleotideMatrixEngine engine = new TrinucleotideMatrixEngine(new VariantPreparer(),
                new ContextExtractor(reference, 10), new ApobecEnrichmentScorer());
        final ApobecEnrichmentResult x = engine.run(variants).getEnrichment("SAMPLE_X");
        Assert.assertEquals(x.getAggregate().getBackground(), new BackgroundComposition(19, 6, 24, 14, 4, 0, 0, 1));
        Assert.assertEquals(x.getAggregate().getBackground().getBases(), 63);
        Assert.assertEquals(x.getEnrichmentRatio(), 1.5, TOLERANCE);
        Assert.assertEquals(x.getPValue(), 0.6285714, TOLERANCE);
        Assert.assertFalse(x.isEnriched());
    }

    @Test
    public void testIgnoredContig() {
        final TrinucleotideMatrixEngine engine = new TrinucleotideMatrixEngine(
                new VariantPreparer(true, Collections.singletonList("chr3"), null, VariantPreparer.PrefixMode.ADD),
                new ContextExtractor(reference), new ApobecEnrichmentScorer());
        final TrinucleotideMatrixResult result = engine.run(variants);
        Assert.assertFalse(result.getDiagnostics().hasWarnings());
        Assert.assertEquals(result.getMatrix().getRowCount(), 2);
    }

    @Test(expectedExceptions = UserException.NoSnvsRemaining.class)
    public void testAllVariantsOnMissingContigs() {
        new TrinucleotideMatrixEngine(reference).run(Collections.singletonList(
                MafVariant.snv("s", "chr3", 15, 'G', 'A', "Missense_Mutation")));
    }

    @Test(expectedExceptions = UserException.NoSnvsRemaining.class)
    public void testNoSnvs() {
        new TrinucleotideMatrixEngine(reference).run(Collections.singletonList(
                new MafVariant("s", "chr1", 95, 95, "G", "-", "DEL", "Frame_Shift_Del", null)));
    }

    @Test
    public void testInMemoryReference() {
        final ReferenceDataSource memory = ReferenceDataSource.of(ImmutableMap.of("1", "GGTCAGGAATCTAA"));
        final TrinucleotideMatrixResult result = new TrinucleotideMatrixEngine(memory).run(Arrays.asList(
                MafVariant.snv("s", "1", 4, 'C', 'T', "Missense_Mutation"),
                MafVariant.snv("s", "1", 11, 'C', 'G', "Silent")));
        Assert.assertEquals(result.getMatrix().getRow("s").getCount("T[C>T]A"), 1);
        Assert.assertEquals(result.getMatrix().getRow("s").getCount("T[C>G]T"), 1);
        Assert.assertEquals(result.getEnrichment("s").getAggregate().getApobecMotifCount(), 2);
    }
}
