package org.broadinstitute.signatures.tools.signatures;

import org.aeonbits.owner.ConfigCache;
import org.broadinstitute.signatures.CommandLineProgramTest;
import org.broadinstitute.signatures.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.testutils.ArgumentsBuilder;
import org.broadinstitute.signatures.utils.config.ConfigFactory;
import org.broadinstitute.signatures.utils.config.SignaturesConfig;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.*;

public final class TrinucleotideMatrixIntegrationTest extends CommandLineProgramTest {

    private static final String OVERRIDE_CONFIG = publicTestDir + "org/broadinstitute/signatures/utils/config/test_override.properties";

    private String maf(final String name) {
        return new File(getToolTestDataDir(), name).getAbsolutePath();
    }

    private static ArgumentsBuilder baseArguments(final String input, final File matrixOutput) {
        return new ArgumentsBuilder()
                .addInput(input)
                .addReference(trinucleotideReference)
                .addOutput(matrixOutput);
    }

    /**
     * @return rows keyed by their first column, each mapping column names to values.
     */
    private static Map<String, Map<String, String>> readTable(final File file) throws IOException {
        final List<String> lines = Files.readAllLines(file.toPath());
        final String[] header = lines.get(0).split("\t", -1);
        final Map<String, Map<String, String>> rows = new LinkedHashMap<>();
        for (final String line : lines.subList(1, lines.size())) {
            final String[] values = line.split("\t", -1);
            Assert.assertEquals(values.length, header.length, line);
            final Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < header.length; i++) {
                row.put(header[i], values[i]);
            }
            rows.put(values[0], row);
        }
        return rows;
    }

    private static int total(final Map<String, String> matrixRow) {
        return matrixRow.entrySet().stream()
                .filter(e -> !e.getKey().equals(MafReader.TUMOR_SAMPLE_BARCODE_COLUMN))
                .mapToInt(e -> Integer.parseInt(e.getValue()))
                .sum();
    }

    @Test
    public void testMatrixAndEnrichmentOutputs() throws IOException {
        final File matrixOutput = createTempFile("matrix", ".tsv");
        final File apobecOutput = createTempFile("apobec", ".tsv");
        final Object result = runCommandLine(baseArguments(maf("two_samples.maf"), matrixOutput)
                .add(TrinucleotideMatrix.APOBEC_OUTPUT_LONG_NAME, apobecOutput));
        Assert.assertEquals(result, 2);

        final Map<String, Map<String, String>> matrix = readTable(matrixOutput);
        Assert.assertEquals(new ArrayList<>(matrix.keySet()), Arrays.asList("SAMPLE_X", "SAMPLE_Y"));
        Assert.assertEquals(matrix.get("SAMPLE_X").size(), 97);
        Assert.assertEquals(matrix.get("SAMPLE_X").get("T[C>T]A"), "3");
        Assert.assertEquals(total(matrix.get("SAMPLE_X")), 3);
        Assert.assertEquals(matrix.get("SAMPLE_Y").get("G[T>C]G"), "3");
        Assert.assertEquals(total(matrix.get("SAMPLE_Y")), 3);

        final Map<String, Map<String, String>> enrichment = readTable(apobecOutput);
        Assert.assertEquals(new ArrayList<>(enrichment.keySet()), Arrays.asList("SAMPLE_X", "SAMPLE_Y"));
        final Map<String, String> x = enrichment.get("SAMPLE_X");
        Assert.assertEquals(x.get("C>T"), "3");
        Assert.assertEquals(x.get("n_C>G_and_C>T"), "3");
        Assert.assertEquals(x.get("tCw_to_G+tCw_to_T"), "3");
        Assert.assertEquals(x.get("n_bg_C"), "16");
        Assert.assertEquals(x.get("n_bg_tcw"), "5");
        Assert.assertEquals(x.get("n_bg_bases"), "123");
        Assert.assertEquals(Double.parseDouble(x.get("APOBEC_Enrichment")), 3.2, 1e-6);
        Assert.assertEquals(Double.parseDouble(x.get("fisher_pvalue")), 0.3092437, 1e-6);
        Assert.assertEquals(Double.parseDouble(x.get("or")), Double.POSITIVE_INFINITY);
        Assert.assertEquals(Double.parseDouble(x.get("ci.low")), 0.2673581, 1e-6);
        Assert.assertEquals(x.get("APOBEC_Enriched"), "yes");

        final Map<String, String> y = enrichment.get("SAMPLE_Y");
        Assert.assertEquals(y.get("A>G"), "3");
        Assert.assertEquals(y.get("n_C>G_and_C>T"), "0");
        Assert.assertEquals(y.get("APOBEC_Enrichment"), "NA");
        Assert.assertEquals(y.get("fisher_pvalue"), "NA");
        Assert.assertEquals(y.get("APOBEC_Enriched"), "no");
    }

    @Test
    public void testWithoutSynonymousVariants() throws IOException {
        final File matrixOutput = createTempFile("matrix", ".tsv");
        runCommandLine(baseArguments(maf("two_samples.maf"), matrixOutput)
                .add(TrinucleotideMatrix.USE_SYNONYMOUS_LONG_NAME, false));
        final Map<String, Map<String, String>> matrix = readTable(matrixOutput);
        Assert.assertEquals(matrix.get("SAMPLE_X").get("T[C>T]A"), "2");
        Assert.assertEquals(matrix.get("SAMPLE_Y").get("G[T>C]G"), "2");
    }

    @Test
    public void testContigPrefix() throws IOException {
        final File withPrefix = createTempFile("matrix", ".tsv");
        runCommandLine(baseArguments(maf("two_samples.maf"), withPrefix));
        final File addedPrefix = createTempFile("matrix", ".tsv");
        runCommandLine(baseArguments(maf("two_samples_no_chr_prefix.maf"), addedPrefix)
                .add(TrinucleotideMatrix.CONTIG_PREFIX_LONG_NAME, "chr"));
        Assert.assertEquals(Files.readAllLines(addedPrefix.toPath()), Files.readAllLines(withPrefix.toPath()));
    }

    @Test
    public void testIgnoredContigAndEnrichmentThreshold() throws IOException {
        final File matrixOutput = createTempFile("matrix", ".tsv");
        final File apobecOutput = createTempFile("apobec", ".tsv");
        runCommandLine(baseArguments(maf("two_samples.maf"), matrixOutput)
                .add(TrinucleotideMatrix.IGNORE_CONTIG_LONG_NAME, "chr3")
                .add(TrinucleotideMatrix.ENRICHMENT_THRESHOLD_LONG_NAME, 3.5)
                .add(TrinucleotideMatrix.APOBEC_OUTPUT_LONG_NAME, apobecOutput));
        Assert.assertEquals(readTable(apobecOutput).get("SAMPLE_X").get("APOBEC_Enriched"), "no");
    }

    @Test
    public void testBackgroundFlankSize() throws IOException {
        final File matrixOutput = createTempFile("matrix", ".tsv");
        final File apobecOutput = createTempFile("apobec", ".tsv");
        runCommandLine(baseArguments(maf("two_samples.maf"), matrixOutput)
                .add(TrinucleotideMatrix.BACKGROUND_FLANK_SIZE_LONG_NAME, 10)
                .add(TrinucleotideMatrix.APOBEC_OUTPUT_LONG_NAME, apobecOutput));
        final Map<String, String> x = readTable(apobecOutput).get("SAMPLE_X");
        Assert.assertEquals(x.get("n_bg_bases"), "63");
        Assert.assertEquals(Double.parseDouble(x.get("APOBEC_Enrichment")), 1.5, 1e-6);
        Assert.assertEquals(x.get("APOBEC_Enriched"), "no");
    }

    @Test
    public void testConfigFile() throws IOException {
        final File matrixOutput = createTempFile("matrix", ".tsv");
        final File apobecOutput = createTempFile("apobec", ".tsv");
        try {
            runCommandLine(baseArguments(maf("two_samples.maf"), matrixOutput)
                    .add(StandardArgumentDefinitions.CONFIG_FILE_OPTION, OVERRIDE_CONFIG)
                    .add(TrinucleotideMatrix.APOBEC_OUTPUT_LONG_NAME, apobecOutput));
        } finally {
            org.aeonbits.owner.ConfigFactory.setProperty(SignaturesConfig.CONFIG_FILE_VARIABLE_FILE_NAME, "/dev/null");
            ConfigCache.remove(SignaturesConfig.class);
        }
        final Map<String, String> x = readTable(apobecOutput).get("SAMPLE_X");
        Assert.assertEquals(x.get("n_bg_bases"), "63");
        Assert.assertEquals(ConfigFactory.getInstance().getSignaturesConfig().background_flank_size(), 20);
    }

    @Test(expectedExceptions = UserException.NoSnvsRemaining.class)
    public void testOnlyIndels() {
        runCommandLine(baseArguments(maf("indels_only.maf"), createTempFile("matrix", ".tsv")));
    }

    @Test(expectedExceptions = UserException.NoSnvsRemaining.class)
    public void testOnlyUnknownContigs() {
        runCommandLine(baseArguments(maf("unknown_contigs.maf"), createTempFile("matrix", ".tsv")));
    }

    @Test(expectedExceptions = UserException.NoSnvsRemaining.class)
    public void testRemovingPrefixLosesAllContigs() {
        runCommandLine(baseArguments(maf("two_samples.maf"), createTempFile("matrix", ".tsv"))
                .add(TrinucleotideMatrix.CONTIG_PREFIX_LONG_NAME, "chr")
                .addFlag(TrinucleotideMatrix.REMOVE_PREFIX_LONG_NAME));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingColumns() {
        runCommandLine(baseArguments(maf("missing_columns.maf"), createTempFile("matrix", ".tsv")));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingInput() {
        runCommandLine(baseArguments(maf("no_such_file.maf"), createTempFile("matrix", ".tsv")));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testRemovePrefixNeedsPrefix() {
        runCommandLine(baseArguments(maf("two_samples.maf"), createTempFile("matrix", ".tsv"))
                .addFlag(TrinucleotideMatrix.REMOVE_PREFIX_LONG_NAME));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testRejectsZeroFlankSize() {
        runCommandLine(baseArguments(maf("two_samples.maf"), createTempFile("matrix", ".tsv"))
                .add(TrinucleotideMatrix.BACKGROUND_FLANK_SIZE_LONG_NAME, 0));
    }
}
