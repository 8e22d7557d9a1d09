package org.broadinstitute.signatures.tools.signatures;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.signatures.engine.ReferenceDataSource;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.Utils;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the whole pipeline: preparation, context extraction, classification, per-sample aggregation,
 * APOBEC enrichment scoring and matrix construction.
 *
 * <p>
 * The reference is owned by the caller; the engine only queries it.
 * </p>
 */
public final class TrinucleotideMatrixEngine {
    private static final Logger logger = LogManager.getLogger(TrinucleotideMatrixEngine.class);

    private final VariantPreparer preparer;
    private final ContextExtractor extractor;
    private final ApobecEnrichmentScorer scorer;

    public TrinucleotideMatrixEngine(final ReferenceDataSource reference) {
        this(new VariantPreparer(), new ContextExtractor(reference), new ApobecEnrichmentScorer());
    }

    public TrinucleotideMatrixEngine(final VariantPreparer preparer, final ContextExtractor extractor,
                                     final ApobecEnrichmentScorer scorer) {
        this.preparer = Utils.nonNull(preparer);
        this.extractor = Utils.nonNull(extractor);
        this.scorer = Utils.nonNull(scorer);
    }

    /**
     * Runs on variants that have not been split into silent and non-silent pools.
     */
    public TrinucleotideMatrixResult run(final List<MafVariant> variants) {
        final MafReader.Partition partition = MafReader.Partition.of(Utils.nonNull(variants));
        return run(partition.getMain(), partition.getSilent());
    }

    /**
     * @throws UserException.NoSnvsRemaining if no single nucleotide variant survives preparation or context extraction.
     */
    public TrinucleotideMatrixResult run(final List<MafVariant> mainVariants, final List<MafVariant> silentVariants) {
        final List<MafVariant> snvs = preparer.prepare(mainVariants, silentVariants);

        logger.info("Extracting 5' and 3' adjacent bases");
        logger.info(String.format("Extracting +/- %dbp around mutated bases for background estimation", extractor.getBackgroundFlankSize()));
        final ContextExtractor.Result extraction = extractor.extract(snvs);
        final TrinucleotideMatrixDiagnostics diagnostics =
                new TrinucleotideMatrixDiagnostics(extraction.getContigMismatch(), extraction.getContextIntegrityWarnings());
        if (extraction.getContexts().isEmpty()) {
            throw new UserException.NoSnvsRemaining(String.format(
                    "Zero SNPs to analyze after matching the reference: %d variants on missing contigs %s, %d with an inconsistent context",
                    extraction.getContigMismatch().getDroppedVariantCount(), extraction.getContigMismatch().getDroppedContigs(),
                    extraction.getContextIntegrityWarnings().size()));
        }

        final List<SubstitutionRecord> records = extraction.getContexts().stream()
                .map(SubstitutionClassifier::classify)
                .collect(Collectors.toList());
        final List<SampleAggregate> aggregates = SampleAggregator.aggregate(records);

        logger.info("Estimating APOBEC enrichment scores");
        logger.info("Performing one-way Fisher's test for APOBEC enrichment");
        final List<ApobecEnrichmentResult> enrichment = scorer.scoreAll(aggregates);

        logger.info("Creating mutation matrix");
        final MutationMatrix matrix = MutationMatrixBuilder.build(aggregates);
        logger.info(String.format("matrix of dimension %dx%d", matrix.getRowCount(), matrix.getColumnCount()));

        if (diagnostics.hasWarnings()) {
            logger.warn(diagnostics.toString());
        }
        return new TrinucleotideMatrixResult(matrix, Collections.unmodifiableList(enrichment), diagnostics);
    }
}
