package org.broadinstitute.signatures.tools.signatures;

import org.broadinstitute.signatures.utils.Utils;

/**
 * Classification of a variant in its trinucleotide context.
 *
 * <p>
 * The substitution is reported twice: as observed ({@code substitution}, e.g. "G>A", with motif "T[G>A]A")
 * and folded onto the pyrimidine strand ({@code substitutionType}, "C>T", with motif "T[C>T]A").
 * Folding keeps the observed flanking bases.
 * </p>
 */
public final class SubstitutionRecord {

    private final SequenceContext context;
    private final String substitution;
    private final SubstitutionType substitutionType;
    private final String substitutionMotif;
    private final String substitutionTypeMotif;

    public SubstitutionRecord(final SequenceContext context, final String substitution, final SubstitutionType substitutionType,
                              final String substitutionMotif, final String substitutionTypeMotif) {
        this.context = Utils.nonNull(context);
        this.substitution = Utils.nonNull(substitution);
        this.substitutionType = Utils.nonNull(substitutionType);
        this.substitutionMotif = Utils.nonNull(substitutionMotif);
        this.substitutionTypeMotif = Utils.nonNull(substitutionTypeMotif);
    }

    public SequenceContext getContext() {
        return context;
    }

    public String getSampleId() {
        return context.getSampleId();
    }

    public String getSubstitution() {
        return substitution;
    }

    public SubstitutionType getSubstitutionType() {
        return substitutionType;
    }

    public String getSubstitutionMotif() {
        return substitutionMotif;
    }

    public String getSubstitutionTypeMotif() {
        return substitutionTypeMotif;
    }

    @Override
    public String toString() {
        return getSampleId() + " " + substitutionMotif + " (" + substitutionTypeMotif + ")";
    }
}
