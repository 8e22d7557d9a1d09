package org.broadinstitute.signatures.tools.signatures;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.signatures.utils.FisherExactTest;
import org.broadinstitute.signatures.utils.Utils;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scores APOBEC mutagenesis per sample, following Roberts et al. (Nat Genet 2013):
 *
 * <pre>
 *     E = (n_tcw / n_C) / (background_tcw / background_C)
 * </pre>
 *
 * where n_tcw counts T[C>T]W, T[C>G]W mutations (and their wGa reverse complements), n_C counts all C>T and C>G
 * mutations in either orientation, and the background counts come from the windows around each mutation.
 */
public final class ApobecEnrichmentScorer {
    private static final Logger logger = LogManager.getLogger(ApobecEnrichmentScorer.class);

    public static final double DEFAULT_ENRICHMENT_THRESHOLD = 2.0;
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    /**
     * Orders by p-value ascending with undefined p-values last, then by sample id.
     */
    public static final Comparator<ApobecEnrichmentResult> P_VALUE_ORDER =
            Comparator.comparingDouble(ApobecEnrichmentScorer::sortablePValue)
                    .thenComparing(ApobecEnrichmentResult::getSampleId);

    private final double enrichmentThreshold;
    private final double confidenceLevel;

    public ApobecEnrichmentScorer() {
        this(DEFAULT_ENRICHMENT_THRESHOLD, DEFAULT_CONFIDENCE_LEVEL);
    }

    public ApobecEnrichmentScorer(final double enrichmentThreshold, final double confidenceLevel) {
        Utils.validateArg(enrichmentThreshold >= 0, () -> "enrichment threshold must be non-negative but was " + enrichmentThreshold);
        Utils.validateArg(confidenceLevel > 0 && confidenceLevel < 1, () -> "confidence level must be in (0, 1) but was " + confidenceLevel);
        this.enrichmentThreshold = enrichmentThreshold;
        this.confidenceLevel = confidenceLevel;
    }

    public double getEnrichmentThreshold() {
        return enrichmentThreshold;
    }

    /**
     * @return NaN if the APOBEC-type mutation count or the background C count is zero; positive infinity when tCw/wGa
     * mutations occur over a background without tCw motifs.
     */
    public static double enrichmentRatio(final SampleAggregate aggregate) {
        final BackgroundComposition background = aggregate.getBackground();
        if (aggregate.getApobecTypeCount() == 0 || background.getC() == 0) {
            return Double.NaN;
        }
        final double mutationFraction = (double) aggregate.getApobecMotifCount() / aggregate.getApobecTypeCount();
        final double backgroundFraction = (double) background.getTcw() / background.getC();
        return mutationFraction / backgroundFraction;
    }

    /**
     * The table tested for enrichment:
     * <pre>
     *     | tCw/wGa mutations        | other APOBEC-type mutations     |
     *     | background C + tcw       | background C - tcw              |
     * </pre>
     */
    public static int[][] contingencyTable(final SampleAggregate aggregate) {
        final BackgroundComposition background = aggregate.getBackground();
        final int combined = aggregate.getApobecMotifCount();
        return new int[][]{
                {combined, aggregate.getApobecTypeCount() - combined},
                {background.getC() + background.getTcw(), background.getC() - background.getTcw()}};
    }

    public ApobecEnrichmentResult score(final SampleAggregate aggregate) {
        Utils.nonNull(aggregate);
        final double ratio = enrichmentRatio(aggregate);
        final boolean enriched = !Double.isNaN(ratio) && ratio > enrichmentThreshold;
        if (aggregate.getApobecTypeCount() == 0 || aggregate.getBackground().getC() == 0) {
            logger.debug("Enrichment test undefined for sample " + aggregate.getSampleId());
            return new ApobecEnrichmentResult(aggregate, ratio, Double.NaN, Double.NaN, Double.NaN, Double.NaN, enriched);
        }
        final FisherExactTest.Result test = FisherExactTest.oneSidedGreater(contingencyTable(aggregate), confidenceLevel);
        return new ApobecEnrichmentResult(aggregate, ratio, test.getPValue(), test.getOddsRatio(),
                test.getConfidenceIntervalLow(), test.getConfidenceIntervalHigh(), enriched);
    }

    /**
     * @return results sorted by {@link #P_VALUE_ORDER}.
     */
    public List<ApobecEnrichmentResult> scoreAll(final List<SampleAggregate> aggregates) {
        Utils.nonNull(aggregates);
        final List<ApobecEnrichmentResult> results = aggregates.stream()
                .map(this::score)
                .sorted(P_VALUE_ORDER)
                .collect(Collectors.toList());
        final long enrichedCount = results.stream().filter(ApobecEnrichmentResult::isEnriched).count();
        logger.info(String.format("APOBEC related mutations are enriched in %s%% of samples (APOBEC enrichment score > %s ; %d of %d samples)",
                Utils.formattedPercent(enrichedCount, results.size()), enrichmentThreshold, enrichedCount, results.size()));
        return results;
    }

    private static double sortablePValue(final ApobecEnrichmentResult result) {
        return Double.isNaN(result.getPValue()) ? Double.POSITIVE_INFINITY : result.getPValue();
    }
}
