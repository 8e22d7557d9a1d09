package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.broadinstitute.signatures.utils.Utils;

import java.util.List;
import java.util.Map;

/**
 * The six single base substitution classes, named by the pyrimidine (C or T) of the mutated base pair.
 *
 * Each class collects a substitution and its reverse complement, e.g. G>A is reported as C>T.
 */
public enum SubstitutionType {
    C_A("C>A"),
    C_G("C>G"),
    C_T("C>T"),
    T_A("T>A"),
    T_C("T>C"),
    T_G("T>G");

    private static final Map<String, SubstitutionType> BY_SUBSTITUTION = ImmutableMap.<String, SubstitutionType>builder()
            .put("A>G", T_C).put("T>C", T_C)
            .put("C>T", C_T).put("G>A", C_T)
            .put("A>T", T_A).put("T>A", T_A)
            .put("A>C", T_G).put("T>G", T_G)
            .put("C>A", C_A).put("G>T", C_A)
            .put("C>G", C_G).put("G>C", C_G)
            .build();

    private static final List<String> RAW_SUBSTITUTIONS = ImmutableList.sortedCopyOf(BY_SUBSTITUTION.keySet());

    private final String label;

    SubstitutionType(final String label) {
        this.label = label;
    }

    /**
     * @return the substitution label, e.g. "C>T".
     */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }

    /**
     * @return true if {@code substitution} is one of the twelve "REF>ALT" labels between distinct nucleotides.
     */
    public static boolean isClassifiable(final String substitution) {
        return BY_SUBSTITUTION.containsKey(substitution);
    }

    /**
     * Normalizes a raw "REF>ALT" substitution to its pyrimidine class.
     *
     * @throws IllegalArgumentException if the substitution is not between two distinct upper-case nucleotides.
     */
    public static SubstitutionType fromSubstitution(final String substitution) {
        final SubstitutionType type = BY_SUBSTITUTION.get(Utils.nonNull(substitution));
        Utils.validateArg(type != null, () -> "not a single base substitution: " + substitution);
        return type;
    }

    /**
     * The twelve raw substitution labels in alphabetical order.
     */
    public static List<String> rawSubstitutions() {
        return RAW_SUBSTITUTIONS;
    }
}
