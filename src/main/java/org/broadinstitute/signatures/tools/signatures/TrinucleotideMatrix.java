package org.broadinstitute.signatures.tools.signatures;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.signatures.cmdline.CommandLineProgram;
import org.broadinstitute.signatures.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.signatures.cmdline.programgroups.MutationalSignaturesProgramGroup;
import org.broadinstitute.signatures.engine.ReferenceDataSource;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.config.ConfigFactory;
import org.broadinstitute.signatures.utils.config.SignaturesConfig;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the 96-class trinucleotide mutation matrix of each sample in a MAF file and estimates APOBEC enrichment.
 *
 * <p>Every single nucleotide variant is placed in one of 96 classes given by its pyrimidine-normalized substitution
 * (C>A, C>G, C>T, T>A, T>C, T>G) and the bases immediately 5' and 3' of it. The same variants are used to compute an
 * APOBEC enrichment score as described by Roberts et al. (Nat Genet 2013), with a one-sided Fisher's exact test of
 * tCw mutations against the tCw motifs found within 20bp of each mutated base.</p>
 *
 * <h3>Input</h3>
 * <p>
 * A MAF file (optionally gzipped) and the indexed FASTA reference the variants were called against. Variants on
 * contigs missing from the reference are dropped with a warning; use --contig-prefix or --remove-prefix to reconcile
 * names such as "1" and "chr1".
 * </p>
 *
 * <h3>Output</h3>
 * <p>
 * A tab-separated matrix with one row per sample and the 96 classes as columns:
 * <pre>
 * Tumor_Sample_Barcode	A[C>A]A	A[C>A]C	...	T[T>G]T
 * TCGA-A1-A0SB	0	2	...	1
 * </pre>
 * and, if --apobec-output is given, a table of per-sample mutation counts, background counts and enrichment
 * statistics sorted by Fisher's test p-value.
 * </p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * signatures TrinucleotideMatrix \
 *   -I tumors.maf.gz \
 *   -R Homo_sapiens_assembly38.fasta \
 *   -O trinucleotide_matrix.tsv \
 *   --apobec-output apobec_enrichment.tsv \
 *   --contig-prefix chr
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Builds the 96-class trinucleotide substitution matrix of each sample from a MAF file and estimates APOBEC enrichment with a one-sided Fisher's exact test.",
        oneLineSummary = "Build a trinucleotide mutation matrix and APOBEC enrichment scores",
        programGroup = MutationalSignaturesProgramGroup.class
)
@DocumentedFeature
public final class TrinucleotideMatrix extends CommandLineProgram {

    public static final String APOBEC_OUTPUT_LONG_NAME = "apobec-output";
    public static final String CONTIG_PREFIX_LONG_NAME = "contig-prefix";
    public static final String REMOVE_PREFIX_LONG_NAME = "remove-prefix";
    public static final String IGNORE_CONTIG_LONG_NAME = "ignore-contig";
    public static final String USE_SYNONYMOUS_LONG_NAME = "use-synonymous";
    public static final String BACKGROUND_FLANK_SIZE_LONG_NAME = "background-flank-size";
    public static final String ENRICHMENT_THRESHOLD_LONG_NAME = "enrichment-threshold";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME, shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Input MAF file.")
    private File inputMaf;

    @Argument(fullName = StandardArgumentDefinitions.REFERENCE_LONG_NAME, shortName = StandardArgumentDefinitions.REFERENCE_SHORT_NAME,
            doc = "Indexed FASTA reference the variants are called against.")
    private File reference;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output file for the sample by 96-class mutation matrix.")
    private File outputMatrix;

    @Argument(fullName = APOBEC_OUTPUT_LONG_NAME, doc = "Output file for the APOBEC enrichment table.", optional = true)
    private File apobecOutput = null;

    @Argument(fullName = CONTIG_PREFIX_LONG_NAME, doc = "Prefix to add to (or, with --" + REMOVE_PREFIX_LONG_NAME + ", remove from) contig names so that they match the reference.", optional = true)
    private String contigPrefix = null;

    @Argument(fullName = REMOVE_PREFIX_LONG_NAME, doc = "Remove the contig prefix instead of adding it.", optional = true)
    private boolean removePrefix = false;

    @Argument(fullName = IGNORE_CONTIG_LONG_NAME, doc = "Contig whose variants are excluded; may be specified multiple times.", optional = true)
    private List<String> ignoredContigs = new ArrayList<>();

    @Argument(fullName = USE_SYNONYMOUS_LONG_NAME, doc = "Whether to include variants with silent classifications.", optional = true)
    private boolean useSynonymous = true;

    @Argument(fullName = BACKGROUND_FLANK_SIZE_LONG_NAME, doc = "Number of bases on each side of a variant used for the background composition.", optional = true, minValue = 1)
    private int backgroundFlankSize = ConfigFactory.getInstance().getSignaturesConfig().background_flank_size();

    @Argument(fullName = ENRICHMENT_THRESHOLD_LONG_NAME, doc = "Enrichment score above which a sample is called APOBEC enriched.", optional = true, minValue = 0)
    private double enrichmentThreshold = ConfigFactory.getInstance().getSignaturesConfig().apobec_enrichment_threshold();

    @Override
    protected String[] customCommandLineValidation() {
        if (removePrefix && contigPrefix == null) {
            return new String[]{"--" + REMOVE_PREFIX_LONG_NAME + " requires --" + CONTIG_PREFIX_LONG_NAME};
        }
        return null;
    }

    @Override
    protected Object doWork() {
        final SignaturesConfig config = ConfigFactory.getInstance().getSignaturesConfig();
        final MafReader.Partition variants = MafReader.readPartitioned(inputMaf.toPath());
        logger.info(String.format("%d variants with silent classifications", variants.getSilent().size()));

        final VariantPreparer preparer = new VariantPreparer(useSynonymous, ignoredContigs, contigPrefix,
                removePrefix ? VariantPreparer.PrefixMode.REMOVE : VariantPreparer.PrefixMode.ADD);
        final ApobecEnrichmentScorer scorer = new ApobecEnrichmentScorer(enrichmentThreshold, config.fisher_confidence_level());

        final TrinucleotideMatrixResult result;
        try (final ReferenceDataSource referenceDataSource = ReferenceDataSource.of(reference.toPath())) {
            final TrinucleotideMatrixEngine engine = new TrinucleotideMatrixEngine(preparer,
                    new ContextExtractor(referenceDataSource, backgroundFlankSize), scorer);
            result = engine.run(variants.getMain(), variants.getSilent());
        }

        writeMatrix(result.getMatrix());
        if (apobecOutput != null) {
            writeEnrichment(result.getEnrichment());
        }
        return result.getMatrix().getRowCount();
    }

    private void writeMatrix(final MutationMatrix matrix) {
        try (final MutationMatrixWriter writer = new MutationMatrixWriter(outputMatrix.toPath())) {
            writer.writeAllRecords(matrix.getRows());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputMatrix, e);
        }
    }

    private void writeEnrichment(final List<ApobecEnrichmentResult> enrichment) {
        try (final ApobecEnrichmentTableWriter writer = new ApobecEnrichmentTableWriter(apobecOutput.toPath())) {
            writer.writeAllRecords(enrichment);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(apobecOutput, e);
        }
    }
}
