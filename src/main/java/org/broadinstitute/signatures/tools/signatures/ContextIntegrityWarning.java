package org.broadinstitute.signatures.tools.signatures;

import org.broadinstitute.signatures.utils.Utils;

/**
 * A variant excluded from the counts because its reference context could not be trusted.
 */
public final class ContextIntegrityWarning {

    public enum Reason {
        /** The middle base of the reference trinucleotide is not the variant's reference allele. */
        REFERENCE_MISMATCH,
        /** The trinucleotide would extend past either end of the contig. */
        OUT_OF_CONTIG_BOUNDS,
        /** A flanking base of the trinucleotide is not A, C, G or T. */
        AMBIGUOUS_FLANKING_BASE,
        /** The alleles do not form one of the twelve single base substitutions. */
        UNCLASSIFIABLE_SUBSTITUTION
    }

    private final MafVariant variant;
    private final Reason reason;
    private final String observedTrinucleotide;

    /**
     * @param observedTrinucleotide the reference bases around the variant, or {@code null} if they could not be fetched.
     */
    public ContextIntegrityWarning(final MafVariant variant, final Reason reason, final String observedTrinucleotide) {
        this.variant = Utils.nonNull(variant);
        this.reason = Utils.nonNull(reason);
        this.observedTrinucleotide = observedTrinucleotide;
    }

    public MafVariant getVariant() {
        return variant;
    }

    public Reason getReason() {
        return reason;
    }

    public String getObservedTrinucleotide() {
        return observedTrinucleotide;
    }

    @Override
    public String toString() {
        return reason + ": " + variant + (observedTrinucleotide != null ? " (reference context " + observedTrinucleotide + ")" : "");
    }
}
