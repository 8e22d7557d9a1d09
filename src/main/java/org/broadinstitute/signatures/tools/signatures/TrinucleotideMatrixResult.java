package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.signatures.utils.Utils;

import java.util.List;

/**
 * Output of {@link TrinucleotideMatrixEngine}: the mutation matrix, the APOBEC enrichment table sorted by p-value,
 * and the diagnostics of dropped variants.
 */
public final class TrinucleotideMatrixResult {

    private final MutationMatrix matrix;
    private final List<ApobecEnrichmentResult> enrichment;
    private final TrinucleotideMatrixDiagnostics diagnostics;

    public TrinucleotideMatrixResult(final MutationMatrix matrix, final List<ApobecEnrichmentResult> enrichment,
                                     final TrinucleotideMatrixDiagnostics diagnostics) {
        this.matrix = Utils.nonNull(matrix);
        this.enrichment = ImmutableList.copyOf(Utils.nonNull(enrichment));
        this.diagnostics = Utils.nonNull(diagnostics);
    }

    public MutationMatrix getMatrix() {
        return matrix;
    }

    public List<ApobecEnrichmentResult> getEnrichment() {
        return enrichment;
    }

    public ApobecEnrichmentResult getEnrichment(final String sampleId) {
        return enrichment.stream()
                .filter(r -> r.getSampleId().equals(sampleId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("no such sample: " + sampleId));
    }

    public TrinucleotideMatrixDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
