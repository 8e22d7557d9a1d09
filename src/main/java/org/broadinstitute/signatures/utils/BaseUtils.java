package org.broadinstitute.signatures.utils;

import java.util.Arrays;

/**
 * BaseUtils contains some basic utilities for manipulating nucleotides.
 */
public final class BaseUtils {

    public enum Base {
        A ('A'),
        C ('C'),
        G ('G'),
        T ('T');

        public final byte base;

        private Base(final char base) {
            this.base = (byte)base;
        }
    }

    public static final byte[] BASES = {'A', 'C', 'G', 'T'};

    private static final int[] baseIndexMap = new int[256];
    static {
        Arrays.fill(baseIndexMap, -1);
        baseIndexMap['A'] = Base.A.ordinal();
        baseIndexMap['a'] = Base.A.ordinal();
        baseIndexMap['C'] = Base.C.ordinal();
        baseIndexMap['c'] = Base.C.ordinal();
        baseIndexMap['G'] = Base.G.ordinal();
        baseIndexMap['g'] = Base.G.ordinal();
        baseIndexMap['T'] = Base.T.ordinal();
        baseIndexMap['t'] = Base.T.ordinal();
    }

    /**
     * Private constructor.  No instantiating this class!
     */
    private BaseUtils() {}

    /**
     * Converts a simple base to a base index
     *
     * @param base [AaCcGgTt]
     * @return 0, 1, 2, 3, or -1 if the base can't be understood
     */
    public static int simpleBaseToBaseIndex(final byte base) {
        // we want to make sure we treat the base as an unsigned byte....so that we can access this array with it.
        final int unsignedBase = ((int)base) & 0xff;
        return baseIndexMap[unsignedBase];
    }

    /**
     * Returns true iff the base represented by the byte is a nucleotide base (ACGT), in either case.
     */
    public static boolean isNucleotide( final byte base ) {
        return simpleBaseToBaseIndex(base) != -1;
    }

    /**
     * Returns true iff the base represented by the char is a nucleotide base (ACGT), in either case.
     */
    public static boolean isNucleotide( final char base ) {
        return base < 256 && isNucleotide((byte) base);
    }
}
