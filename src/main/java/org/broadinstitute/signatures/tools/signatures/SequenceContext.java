package org.broadinstitute.signatures.tools.signatures;

import org.broadinstitute.signatures.utils.SimpleInterval;
import org.broadinstitute.signatures.utils.Utils;

/**
 * Reference context of a single nucleotide variant: the trinucleotide centered on it and
 * the wider background window used to estimate motif composition.
 */
public final class SequenceContext {

    private final MafVariant variant;
    private final String trinucleotide;
    private final SimpleInterval backgroundInterval;
    private final String backgroundWindow;
    private final BackgroundComposition composition;

    public SequenceContext(final MafVariant variant, final String trinucleotide,
                           final SimpleInterval backgroundInterval, final String backgroundWindow) {
        this.variant = Utils.nonNull(variant);
        this.trinucleotide = Utils.nonNull(trinucleotide);
        Utils.validateArg(trinucleotide.length() == 3, () -> "trinucleotide must have 3 bases but was " + trinucleotide);
        this.backgroundInterval = Utils.nonNull(backgroundInterval);
        this.backgroundWindow = Utils.nonNull(backgroundWindow);
        Utils.validateArg(backgroundWindow.length() == backgroundInterval.size(),
                () -> "background window length does not match its interval " + backgroundInterval);
        this.composition = BackgroundComposition.of(backgroundWindow);
    }

    public MafVariant getVariant() {
        return variant;
    }

    public String getSampleId() {
        return variant.getSampleId();
    }

    public String getTrinucleotide() {
        return trinucleotide;
    }

    public char getFivePrimeBase() {
        return trinucleotide.charAt(0);
    }

    public char getThreePrimeBase() {
        return trinucleotide.charAt(2);
    }

    public SimpleInterval getBackgroundInterval() {
        return backgroundInterval;
    }

    public String getBackgroundWindow() {
        return backgroundWindow;
    }

    public BackgroundComposition getComposition() {
        return composition;
    }

    @Override
    public String toString() {
        return variant + " " + trinucleotide;
    }
}
