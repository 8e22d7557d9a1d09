package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import org.broadinstitute.signatures.utils.Utils;

/**
 * Mutation and background counts of one sample.
 *
 * <p>
 * Counts are kept in multisets, so any substitution or motif that was not observed counts as zero.
 * Raw motifs keep the observed orientation (e.g. "A[G>A]A"); type motifs are pyrimidine-normalized
 * (e.g. "A[C>T]A") and are the 96 matrix classes.
 * </p>
 */
public final class SampleAggregate {

    private final String sampleId;
    private final ImmutableMultiset<String> substitutionCounts;
    private final ImmutableMultiset<String> motifCounts;
    private final ImmutableMultiset<String> typeMotifCounts;
    private final BackgroundComposition background;

    public SampleAggregate(final String sampleId, final Multiset<String> substitutionCounts,
                           final Multiset<String> motifCounts, final Multiset<String> typeMotifCounts,
                           final BackgroundComposition background) {
        this.sampleId = Utils.nonNull(sampleId);
        this.substitutionCounts = ImmutableMultiset.copyOf(Utils.nonNull(substitutionCounts));
        this.motifCounts = ImmutableMultiset.copyOf(Utils.nonNull(motifCounts));
        this.typeMotifCounts = ImmutableMultiset.copyOf(Utils.nonNull(typeMotifCounts));
        this.background = Utils.nonNull(background);
    }

    public String getSampleId() {
        return sampleId;
    }

    public BackgroundComposition getBackground() {
        return background;
    }

    /**
     * @param substitution raw label such as "G>A".
     */
    public int getSubstitutionCount(final String substitution) {
        return substitutionCounts.count(substitution);
    }

    /**
     * @param motif raw orientation motif such as "T[G>A]A".
     */
    public int getMotifCount(final String motif) {
        return motifCounts.count(motif);
    }

    /**
     * @param typeMotif one of {@link SubstitutionClassifier#CANONICAL_MOTIFS}.
     */
    public int getTypeMotifCount(final String typeMotif) {
        return typeMotifCounts.count(typeMotif);
    }

    public Multiset<String> getTypeMotifCounts() {
        return typeMotifCounts;
    }

    /**
     * @return number of mutations whose reference base is {@code base}.
     */
    public int getReferenceBaseCount(final char base) {
        int result = 0;
        for (final String substitution : SubstitutionType.rawSubstitutions()) {
            if (substitution.charAt(0) == base) {
                result += substitutionCounts.count(substitution);
            }
        }
        return result;
    }

    public int getMutationCount() {
        return substitutionCounts.size();
    }

    /**
     * @return C>G, G>C, C>T and G>A mutations: the APOBEC-type mutation count.
     */
    public int getApobecTypeCount() {
        return count("C>G") + count("G>C") + count("C>T") + count("G>A");
    }

    public int getTcwToA() {
        return motif("T[C>A]A") + motif("T[C>A]T");
    }

    public int getTcwToG() {
        return motif("T[C>G]A") + motif("T[C>G]T");
    }

    public int getTcwToT() {
        return motif("T[C>T]A") + motif("T[C>T]T");
    }

    public int getTcw() {
        return getTcwToA() + getTcwToG() + getTcwToT();
    }

    public int getWgaToC() {
        return motif("A[G>C]A") + motif("T[G>C]A");
    }

    public int getWgaToT() {
        return motif("A[G>T]A") + motif("T[G>T]A");
    }

    public int getWgaToA() {
        return motif("A[G>A]A") + motif("T[G>A]A");
    }

    public int getWga() {
        return getWgaToC() + getWgaToT() + getWgaToA();
    }

    /**
     * @return tCw to G/T plus wGa to C/A mutations, the numerator of the enrichment ratio.
     */
    public int getApobecMotifCount() {
        return motif("T[C>G]T") + motif("T[C>G]A") + motif("T[C>T]T") + motif("T[C>T]A")
                + motif("T[G>C]A") + motif("A[G>C]A") + motif("T[G>A]A") + motif("A[G>A]A");
    }

    public int getNonApobecMutationCount() {
        return getMutationCount() - getApobecMotifCount();
    }

    private int count(final String substitution) {
        return substitutionCounts.count(substitution);
    }

    private int motif(final String motif) {
        return motifCounts.count(motif);
    }

    @Override
    public String toString() {
        return "SampleAggregate{" + sampleId + ", mutations=" + getMutationCount() + ", background=" + background + "}";
    }
}
