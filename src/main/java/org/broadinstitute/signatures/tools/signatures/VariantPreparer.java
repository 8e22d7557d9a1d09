package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Selects the variants that enter the trinucleotide matrix.
 *
 * <p>
 * Preparation runs in this order:
 * <ol>
 *     <li>variants with a silent classification are removed from the main pool,</li>
 *     <li>if synonymous variants are used, the separately supplied silent pool is appended,</li>
 *     <li>variants on ignored contigs are removed (exact name match),</li>
 *     <li>contig names are prefixed, or have the prefix removed,</li>
 *     <li>only SNPs with single base alleles are kept.</li>
 * </ol>
 * </p>
 */
public final class VariantPreparer {
    private static final Logger logger = LogManager.getLogger(VariantPreparer.class);

    /**
     * Classifications that do not change the protein product.
     */
    public static final Set<String> SILENT_VARIANT_CLASSIFICATIONS = ImmutableSet.of(
            "3'UTR", "5'UTR", "3'Flank", "Targeted_Region", "Silent", "Intron",
            "RNA", "IGR", "Splice_Region", "5'Flank", "lincRNA");

    public enum PrefixMode {
        /** prepend the prefix to every contig name */
        ADD,
        /** delete every literal occurrence of the prefix from contig names */
        REMOVE
    }

    private final boolean useSynonymous;
    private final Set<String> ignoredContigs;
    private final String contigPrefix;
    private final PrefixMode prefixMode;

    /**
     * Prepares with synonymous variants, no ignored contig and no prefix.
     */
    public VariantPreparer() {
        this(true, Collections.emptySet(), null, PrefixMode.ADD);
    }

    /**
     * @param contigPrefix {@code null} to leave contig names untouched.
     */
    public VariantPreparer(final boolean useSynonymous, final Collection<String> ignoredContigs,
                           final String contigPrefix, final PrefixMode prefixMode) {
        this.useSynonymous = useSynonymous;
        this.ignoredContigs = ImmutableSet.copyOf(Utils.nonNull(ignoredContigs, "ignored contigs cannot be null"));
        Utils.validateArg(contigPrefix == null || !contigPrefix.isEmpty(), "the contig prefix cannot be empty");
        this.contigPrefix = contigPrefix;
        this.prefixMode = Utils.nonNull(prefixMode, "prefix mode cannot be null");
    }

    public static boolean isSilent(final MafVariant variant) {
        return SILENT_VARIANT_CLASSIFICATIONS.contains(variant.getVariantClassification());
    }

    /**
     * @param mainVariants   variants of the main pool.
     * @param silentVariants the silent pool, appended only when synonymous variants are used.
     * @return the single nucleotide variants to classify, in input order.
     * @throws UserException.NoSnvsRemaining if no single nucleotide variant is left.
     */
    public List<MafVariant> prepare(final List<MafVariant> mainVariants, final List<MafVariant> silentVariants) {
        Utils.nonNull(mainVariants, "main variants cannot be null");
        Utils.nonNull(silentVariants, "silent variants cannot be null");

        List<MafVariant> variants = mainVariants.stream()
                .filter(v -> !isSilent(v))
                .collect(Collectors.toList());
        if (useSynonymous) {
            variants.addAll(silentVariants);
        }

        if (!ignoredContigs.isEmpty()) {
            final int before = variants.size();
            variants = variants.stream()
                    .filter(v -> !ignoredContigs.contains(v.getContig()))
                    .collect(Collectors.toList());
            logger.info(String.format("Removed %d variants on ignored contigs %s", before - variants.size(), ignoredContigs));
        }

        if (contigPrefix != null) {
            variants = variants.stream()
                    .map(v -> v.withContig(renameContig(v.getContig())))
                    .collect(Collectors.toList());
        }

        final List<MafVariant> snvs = variants.stream()
                .filter(MafVariant::isSnv)
                .collect(Collectors.toList());
        if (snvs.isEmpty()) {
            throw new UserException.NoSnvsRemaining("Zero SNPs to analyze!");
        }
        logger.info(String.format("Kept %d single nucleotide variants out of %d", snvs.size(), variants.size()));
        return snvs;
    }

    String renameContig(final String contig) {
        return prefixMode == PrefixMode.ADD
                ? contigPrefix + contig
                : StringUtils.replace(contig, contigPrefix, "");
    }
}
