package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.broadinstitute.signatures.utils.Utils;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Variants that were dropped because their contig is not in the reference.
 */
public final class ContigMismatchWarning {

    private final Set<String> droppedContigs;
    private final List<MafVariant> droppedVariants;

    public ContigMismatchWarning(final Collection<String> droppedContigs, final Collection<MafVariant> droppedVariants) {
        this.droppedContigs = ImmutableSet.copyOf(Utils.nonNull(droppedContigs));
        this.droppedVariants = ImmutableList.copyOf(Utils.nonNull(droppedVariants));
    }

    /**
     * Contigs found in the variants but not in the reference, in order of first appearance.
     */
    public Set<String> getDroppedContigs() {
        return droppedContigs;
    }

    public List<MafVariant> getDroppedVariants() {
        return droppedVariants;
    }

    public int getDroppedVariantCount() {
        return droppedVariants.size();
    }

    public boolean isEmpty() {
        return droppedVariants.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Contig names must match the reference. Ignoring %d single nucleotide variants from %s",
                droppedVariants.size(), String.join(", ", droppedContigs));
    }
}
