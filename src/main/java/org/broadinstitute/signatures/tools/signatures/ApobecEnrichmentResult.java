package org.broadinstitute.signatures.tools.signatures;

import org.broadinstitute.signatures.utils.Utils;

/**
 * APOBEC enrichment of one sample: the enrichment ratio and the one-sided Fisher's exact test of
 * tCw/wGa mutations over the tCw motif background.
 *
 * Undefined values (zero denominators) are {@link Double#NaN}.
 */
public final class ApobecEnrichmentResult {

    private final SampleAggregate aggregate;
    private final double enrichmentRatio;
    private final double pValue;
    private final double oddsRatio;
    private final double confidenceIntervalLow;
    private final double confidenceIntervalHigh;
    private final boolean enriched;

    public ApobecEnrichmentResult(final SampleAggregate aggregate, final double enrichmentRatio,
                                  final double pValue, final double oddsRatio,
                                  final double confidenceIntervalLow, final double confidenceIntervalHigh,
                                  final boolean enriched) {
        this.aggregate = Utils.nonNull(aggregate);
        this.enrichmentRatio = enrichmentRatio;
        this.pValue = pValue;
        this.oddsRatio = oddsRatio;
        this.confidenceIntervalLow = confidenceIntervalLow;
        this.confidenceIntervalHigh = confidenceIntervalHigh;
        this.enriched = enriched;
    }

    public String getSampleId() {
        return aggregate.getSampleId();
    }

    public SampleAggregate getAggregate() {
        return aggregate;
    }

    public double getEnrichmentRatio() {
        return enrichmentRatio;
    }

    public double getPValue() {
        return pValue;
    }

    public double getOddsRatio() {
        return oddsRatio;
    }

    public double getConfidenceIntervalLow() {
        return confidenceIntervalLow;
    }

    public double getConfidenceIntervalHigh() {
        return confidenceIntervalHigh;
    }

    /**
     * @return false whenever the ratio is undefined.
     */
    public boolean isEnriched() {
        return enriched;
    }

    public boolean isTestDefined() {
        return !Double.isNaN(pValue);
    }

    @Override
    public String toString() {
        return String.format("%s: enrichment=%s p=%s or=%s ci=[%s, %s] enriched=%b", getSampleId(), enrichmentRatio,
                pValue, oddsRatio, confidenceIntervalLow, confidenceIntervalHigh, enriched);
    }
}
