package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.signatures.utils.Utils;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Structured report of the variants dropped while building the matrix.
 */
public final class TrinucleotideMatrixDiagnostics {

    private final ContigMismatchWarning contigMismatch;
    private final List<ContextIntegrityWarning> contextIntegrityWarnings;

    public TrinucleotideMatrixDiagnostics(final ContigMismatchWarning contigMismatch,
                                          final List<ContextIntegrityWarning> contextIntegrityWarnings) {
        this.contigMismatch = Utils.nonNull(contigMismatch);
        this.contextIntegrityWarnings = ImmutableList.copyOf(Utils.nonNull(contextIntegrityWarnings));
    }

    /**
     * Never {@code null}; {@link ContigMismatchWarning#isEmpty()} when every contig was found.
     */
    public ContigMismatchWarning getContigMismatch() {
        return contigMismatch;
    }

    public List<ContextIntegrityWarning> getContextIntegrityWarnings() {
        return contextIntegrityWarnings;
    }

    public Map<ContextIntegrityWarning.Reason, Long> countContextIntegrityWarningsByReason() {
        return contextIntegrityWarnings.stream()
                .collect(Collectors.groupingBy(ContextIntegrityWarning::getReason, TreeMap::new, Collectors.counting()));
    }

    public boolean hasWarnings() {
        return !contigMismatch.isEmpty() || !contextIntegrityWarnings.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("%d variants on missing contigs, %d variants with an inconsistent reference context %s",
                contigMismatch.getDroppedVariantCount(), contextIntegrityWarnings.size(), countContextIntegrityWarningsByReason());
    }
}
