package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.signatures.utils.tsv.DataLine;
import org.broadinstitute.signatures.utils.tsv.TableColumnCollection;
import org.broadinstitute.signatures.utils.tsv.TableWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Writes APOBEC enrichment results, one row per sample.
 *
 * <p>
 * Columns are the sample id, the twelve raw substitution counts, mutation counts per reference base,
 * tCw/wGa motif mutation counts, the background counts (prefixed with {@code n_bg_}) and the test results.
 * Undefined values are written as {@code NA}.
 * </p>
 */
public final class ApobecEnrichmentTableWriter extends TableWriter<ApobecEnrichmentResult> {

    public static final String APOBEC_ENRICHMENT_COLUMN = "APOBEC_Enrichment";
    public static final String FISHER_PVALUE_COLUMN = "fisher_pvalue";
    public static final String APOBEC_ENRICHED_COLUMN = "APOBEC_Enriched";

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(ImmutableList.<String>builder()
            .add(MafReader.TUMOR_SAMPLE_BARCODE_COLUMN)
            .addAll(SubstitutionType.rawSubstitutions())
            .add("n_A", "n_T", "n_G", "n_C", "n_mutations", "n_C>G_and_C>T")
            .add("tCw_to_A", "tCw_to_T", "tCw_to_G", "tCw", "wGa_to_C", "wGa_to_T", "wGa_to_A", "wGa", "tCw_to_G+tCw_to_T")
            .add("n_bg_A", "n_bg_T", "n_bg_G", "n_bg_C", "n_bg_tcw", "n_bg_wga", "n_bg_bases")
            .add(APOBEC_ENRICHMENT_COLUMN, "non_APOBEC_mutations", FISHER_PVALUE_COLUMN, "or", "ci.low", "ci.high",
                    APOBEC_ENRICHED_COLUMN)
            .build());

    public ApobecEnrichmentTableWriter(final Path path) throws IOException {
        super(path, COLUMNS);
    }

    public ApobecEnrichmentTableWriter(final Writer writer) {
        super(writer, COLUMNS);
    }

    @Override
    protected void composeLine(final ApobecEnrichmentResult record, final DataLine dataLine) {
        final SampleAggregate aggregate = record.getAggregate();
        final BackgroundComposition background = aggregate.getBackground();
        dataLine.append(record.getSampleId());
        for (final String substitution : SubstitutionType.rawSubstitutions()) {
            dataLine.append(aggregate.getSubstitutionCount(substitution));
        }
        dataLine.append(aggregate.getReferenceBaseCount('A'), aggregate.getReferenceBaseCount('T'),
                        aggregate.getReferenceBaseCount('G'), aggregate.getReferenceBaseCount('C'),
                        aggregate.getMutationCount(), aggregate.getApobecTypeCount())
                .append(aggregate.getTcwToA(), aggregate.getTcwToT(), aggregate.getTcwToG(), aggregate.getTcw(),
                        aggregate.getWgaToC(), aggregate.getWgaToT(), aggregate.getWgaToA(), aggregate.getWga(),
                        aggregate.getApobecMotifCount())
                .append(background.getA(), background.getT(), background.getG(), background.getC(),
                        background.getTcw(), background.getWga(), background.getBases())
                .set(APOBEC_ENRICHMENT_COLUMN, record.getEnrichmentRatio())
                .set("non_APOBEC_mutations", aggregate.getNonApobecMutationCount())
                .set(FISHER_PVALUE_COLUMN, record.getPValue())
                .set("or", record.getOddsRatio())
                .set("ci.low", record.getConfidenceIntervalLow())
                .set("ci.high", record.getConfidenceIntervalHigh())
                .set(APOBEC_ENRICHED_COLUMN, record.isEnriched() ? "yes" : "no");
    }
}
