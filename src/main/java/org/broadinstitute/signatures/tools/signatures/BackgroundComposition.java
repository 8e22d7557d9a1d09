package org.broadinstitute.signatures.tools.signatures;

import org.broadinstitute.signatures.utils.Utils;

/**
 * Nucleotide and APOBEC-motif counts over one or more background windows.
 *
 * Motifs are counted on the forward strand with a step of one base, so occurrences may overlap.
 * tCw is TCA + TCT and its reverse complement wGa is TGA + AGA.
 */
public final class BackgroundComposition {

    public static final BackgroundComposition EMPTY = new BackgroundComposition(0, 0, 0, 0, 0, 0, 0, 0);

    private final int a;
    private final int c;
    private final int g;
    private final int t;
    private final int tca;
    private final int tct;
    private final int aga;
    private final int tga;

    public BackgroundComposition(final int a, final int c, final int g, final int t,
                                 final int tca, final int tct, final int aga, final int tga) {
        this.a = a;
        this.c = c;
        this.g = g;
        this.t = t;
        this.tca = tca;
        this.tct = tct;
        this.aga = aga;
        this.tga = tga;
    }

    /**
     * Counts the composition of a single window. Bases are upper-cased; anything but A, C, G and T is not counted.
     */
    public static BackgroundComposition of(final String window) {
        Utils.nonNull(window);
        final String bases = window.toUpperCase();
        int a = 0, c = 0, g = 0, t = 0;
        int tca = 0, tct = 0, aga = 0, tga = 0;
        for (int i = 0; i < bases.length(); i++) {
            switch (bases.charAt(i)) {
                case 'A': a++; break;
                case 'C': c++; break;
                case 'G': g++; break;
                case 'T': t++; break;
                default: break;
            }
            if (i + 3 <= bases.length()) {
                switch (bases.substring(i, i + 3)) {
                    case "TCA": tca++; break;
                    case "TCT": tct++; break;
                    case "AGA": aga++; break;
                    case "TGA": tga++; break;
                    default: break;
                }
            }
        }
        return new BackgroundComposition(a, c, g, t, tca, tct, aga, tga);
    }

    /**
     * @return the element-wise sum of this and {@code other}.
     */
    public BackgroundComposition plus(final BackgroundComposition other) {
        Utils.nonNull(other);
        return new BackgroundComposition(a + other.a, c + other.c, g + other.g, t + other.t,
                tca + other.tca, tct + other.tct, aga + other.aga, tga + other.tga);
    }

    public int getA() {
        return a;
    }

    public int getC() {
        return c;
    }

    public int getG() {
        return g;
    }

    public int getT() {
        return t;
    }

    public int getTca() {
        return tca;
    }

    public int getTct() {
        return tct;
    }

    public int getAga() {
        return aga;
    }

    public int getTga() {
        return tga;
    }

    public int getTcw() {
        return tca + tct;
    }

    public int getWga() {
        return tga + aga;
    }

    /**
     * @return A + C + G + T.
     */
    public int getBases() {
        return a + c + g + t;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final BackgroundComposition that = (BackgroundComposition) o;
        return a == that.a && c == that.c && g == that.g && t == that.t
                && tca == that.tca && tct == that.tct && aga == that.aga && tga == that.tga;
    }

    @Override
    public int hashCode() {
        int result = a;
        result = 31 * result + c;
        result = 31 * result + g;
        result = 31 * result + t;
        result = 31 * result + tca;
        result = 31 * result + tct;
        result = 31 * result + aga;
        result = 31 * result + tga;
        return result;
    }

    @Override
    public String toString() {
        return String.format("A=%d C=%d G=%d T=%d tcw=%d wga=%d", a, c, g, t, getTcw(), getWga());
    }
}
