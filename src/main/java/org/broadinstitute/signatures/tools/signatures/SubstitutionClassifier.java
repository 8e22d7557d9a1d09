package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.signatures.utils.BaseUtils;
import org.broadinstitute.signatures.utils.Utils;

import java.util.List;

/**
 * Places single nucleotide variants into the 96 trinucleotide substitution classes.
 *
 * <p>
 * A class is written as {@code 5'[REF>ALT]3'}, e.g. "T[C>T]A". There are 4 possible 5' bases, 6 pyrimidine
 * substitution types and 4 possible 3' bases. The canonical column order groups classes by substitution type
 * (C>A, C>G, C>T, T>A, T>C, T>G) and, within a type, sorts them by 5' base and then by 3' base.
 * </p>
 */
public final class SubstitutionClassifier {

    /**
     * All 96 pyrimidine-oriented classes in canonical order.
     */
    public static final List<String> CANONICAL_MOTIFS;
    static {
        final ImmutableList.Builder<String> motifs = ImmutableList.builder();
        for (final SubstitutionType type : SubstitutionType.values()) {
            for (final byte fivePrime : BaseUtils.BASES) {
                for (final byte threePrime : BaseUtils.BASES) {
                    motifs.add(motif((char) fivePrime, type.getLabel(), (char) threePrime));
                }
            }
        }
        CANONICAL_MOTIFS = motifs.build();
    }

    private SubstitutionClassifier() {}

    /**
     * @return the raw "REF>ALT" label of the variant, without any normalization.
     */
    public static String substitution(final MafVariant variant) {
        return variant.getReferenceAllele() + ">" + variant.getAlternateAllele();
    }

    public static String motif(final char fivePrime, final String substitution, final char threePrime) {
        return fivePrime + "[" + substitution + "]" + threePrime;
    }

    /**
     * @return the pyrimidine-normalized label for a raw substitution label; normalized labels map to themselves.
     */
    public static String normalize(final String substitution) {
        return SubstitutionType.fromSubstitution(substitution).getLabel();
    }

    /**
     * Classifies a variant from its context.
     *
     * @throws IllegalArgumentException if the substitution is not one of the twelve single base substitutions.
     */
    public static SubstitutionRecord classify(final SequenceContext context) {
        Utils.nonNull(context);
        final String substitution = substitution(context.getVariant());
        final SubstitutionType type = SubstitutionType.fromSubstitution(substitution);
        return new SubstitutionRecord(context, substitution, type,
                motif(context.getFivePrimeBase(), substitution, context.getThreePrimeBase()),
                motif(context.getFivePrimeBase(), type.getLabel(), context.getThreePrimeBase()));
    }
}
