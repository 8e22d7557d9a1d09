package org.broadinstitute.signatures.tools.signatures;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.signatures.engine.ReferenceDataSource;
import org.broadinstitute.signatures.utils.BaseUtils;
import org.broadinstitute.signatures.utils.SimpleInterval;
import org.broadinstitute.signatures.utils.Utils;

import java.util.*;

/**
 * Fetches the reference context of single nucleotide variants.
 *
 * <p>
 * For a variant at {@code pos..end} the trinucleotide is {@code [pos - 1, pos + 1]} and the background window is
 * {@code [pos - flank, end + flank]}, clamped to the contig. Windows of a contig that lie within
 * {@link #DEFAULT_FETCH_MARGIN} bases of each other are read from the reference in a single query, and the windows are
 * sliced from that sequence.
 * </p>
 * <p>
 * Variants on contigs the reference does not have are dropped and reported in a {@link ContigMismatchWarning}.
 * Variants whose context is inconsistent are dropped and reported as {@link ContextIntegrityWarning}s, so that
 * every returned context can be classified into one of the 96 classes.
 * </p>
 */
public final class ContextExtractor {
    private static final Logger logger = LogManager.getLogger(ContextExtractor.class);

    public static final int DEFAULT_BACKGROUND_FLANK_SIZE = 20;

    /**
     * Largest gap, in bases, between two windows fetched in the same reference query.
     */
    public static final int DEFAULT_FETCH_MARGIN = 10_000;

    private final ReferenceDataSource reference;
    private final int backgroundFlankSize;
    private final int fetchMargin;

    public ContextExtractor(final ReferenceDataSource reference) {
        this(reference, DEFAULT_BACKGROUND_FLANK_SIZE);
    }

    /**
     * @param backgroundFlankSize number of bases on each side of the variant in the background window; at least 1.
     */
    public ContextExtractor(final ReferenceDataSource reference, final int backgroundFlankSize) {
        this(reference, backgroundFlankSize, DEFAULT_FETCH_MARGIN);
    }

    @VisibleForTesting
    ContextExtractor(final ReferenceDataSource reference, final int backgroundFlankSize, final int fetchMargin) {
        this.reference = Utils.nonNull(reference, "the reference cannot be null");
        Utils.validateArg(backgroundFlankSize >= 1, () -> "background flank size must be at least 1 but was " + backgroundFlankSize);
        Utils.validateArg(fetchMargin >= 0, () -> "fetch margin must be non-negative but was " + fetchMargin);
        this.backgroundFlankSize = backgroundFlankSize;
        this.fetchMargin = fetchMargin;
    }

    public int getBackgroundFlankSize() {
        return backgroundFlankSize;
    }

    /**
     * Outcome of an extraction: the usable contexts, in input order, and what was dropped.
     */
    public static final class Result {
        private final List<SequenceContext> contexts;
        private final ContigMismatchWarning contigMismatch;
        private final List<ContextIntegrityWarning> contextIntegrityWarnings;

        Result(final List<SequenceContext> contexts, final ContigMismatchWarning contigMismatch,
               final List<ContextIntegrityWarning> contextIntegrityWarnings) {
            this.contexts = ImmutableList.copyOf(contexts);
            this.contigMismatch = contigMismatch;
            this.contextIntegrityWarnings = ImmutableList.copyOf(contextIntegrityWarnings);
        }

        public List<SequenceContext> getContexts() {
            return contexts;
        }

        public ContigMismatchWarning getContigMismatch() {
            return contigMismatch;
        }

        public List<ContextIntegrityWarning> getContextIntegrityWarnings() {
            return contextIntegrityWarnings;
        }
    }

    /**
     * @param variants single nucleotide variants
     */
    public Result extract(final List<MafVariant> variants) {
        Utils.nonNull(variants);
        final Set<String> referenceContigs = reference.listContigs();

        final Map<String, List<Integer>> indicesByContig = new LinkedHashMap<>();
        final Set<String> missingContigs = new LinkedHashSet<>();
        final List<MafVariant> droppedVariants = new ArrayList<>();
        for (int i = 0; i < variants.size(); i++) {
            final MafVariant variant = variants.get(i);
            Utils.validateArg(variant.isSnv(), () -> "not a single nucleotide variant: " + variant);
            if (referenceContigs.contains(variant.getContig())) {
                indicesByContig.computeIfAbsent(variant.getContig(), k -> new ArrayList<>()).add(i);
            } else {
                missingContigs.add(variant.getContig());
                droppedVariants.add(variant);
            }
        }
        final ContigMismatchWarning contigMismatch = new ContigMismatchWarning(missingContigs, droppedVariants);
        if (!contigMismatch.isEmpty()) {
            logger.warn("Contigs in the reference: " + String.join(", ", referenceContigs));
            logger.warn("Contigs missing from the reference: " + String.join(", ", missingContigs));
            logger.warn(contigMismatch.toString());
        }

        final SequenceContext[] contexts = new SequenceContext[variants.size()];
        final ContextIntegrityWarning[] failures = new ContextIntegrityWarning[variants.size()];
        for (final Map.Entry<String, List<Integer>> entry : indicesByContig.entrySet()) {
            extractContig(entry.getKey(), entry.getValue(), variants, contexts, failures);
        }

        final List<SequenceContext> result = new ArrayList<>(variants.size());
        final List<ContextIntegrityWarning> integrityWarnings = new ArrayList<>();
        for (int i = 0; i < variants.size(); i++) {
            if (contexts[i] != null) {
                result.add(contexts[i]);
            } else if (failures[i] != null) {
                logger.warn("Excluding variant with inconsistent reference context. " + failures[i]);
                integrityWarnings.add(failures[i]);
            }
        }
        return new Result(result, contigMismatch, integrityWarnings);
    }

    private void extractContig(final String contig, final List<Integer> indices, final List<MafVariant> variants,
                               final SequenceContext[] contexts, final ContextIntegrityWarning[] failures) {
        final int contigLength = reference.getContigLength(contig);

        final List<Integer> inBounds = new ArrayList<>(indices.size());
        for (final int index : indices) {
            final MafVariant variant = variants.get(index);
            if (variant.getStart() - 1 < 1 || variant.getEnd() + 1 > contigLength) {
                failures[index] = new ContextIntegrityWarning(variant, ContextIntegrityWarning.Reason.OUT_OF_CONTIG_BOUNDS, null);
            } else {
                inBounds.add(index);
            }
        }
        inBounds.sort(Comparator.comparingInt(index -> variants.get(index).getStart()));

        // windows are sorted by start, so each cluster grows until the next window is too far from it
        SimpleInterval span = null;
        final List<Integer> cluster = new ArrayList<>();
        for (final int index : inBounds) {
            final SimpleInterval background = backgroundInterval(variants.get(index), contigLength);
            if (span != null && !span.overlapsWithMargin(background, fetchMargin)) {
                extractCluster(span, cluster, variants, contigLength, contexts, failures);
                span = null;
                cluster.clear();
            }
            span = span == null ? background : span.spanWith(background);
            cluster.add(index);
        }
        if (span != null) {
            extractCluster(span, cluster, variants, contigLength, contexts, failures);
        }
    }

    private void extractCluster(final SimpleInterval span, final List<Integer> cluster, final List<MafVariant> variants,
                                final int contigLength, final SequenceContext[] contexts, final ContextIntegrityWarning[] failures) {
        logger.debug("Fetching " + span + " for " + cluster.size() + " variants");
        final String spanBases = reference.getSequence(span.getContig(), span.getStart(), span.getEnd());
        for (final int index : cluster) {
            final MafVariant variant = variants.get(index);
            final String trinucleotide = slice(spanBases, span, variant.getStart() - 1, variant.getStart() + 1);
            final ContextIntegrityWarning.Reason failure = checkIntegrity(variant, trinucleotide);
            if (failure != null) {
                failures[index] = new ContextIntegrityWarning(variant, failure, trinucleotide);
                continue;
            }
            final SimpleInterval background = backgroundInterval(variant, contigLength);
            contexts[index] = new SequenceContext(variant, trinucleotide, background,
                    slice(spanBases, span, background.getStart(), background.getEnd()));
        }
    }

    private SimpleInterval backgroundInterval(final MafVariant variant, final int contigLength) {
        return new SimpleInterval(variant).expandWithinContig(backgroundFlankSize, contigLength);
    }

    private static String slice(final String spanBases, final SimpleInterval span, final int start, final int end) {
        return spanBases.substring(start - span.getStart(), end - span.getStart() + 1);
    }

    /**
     * @return null if the variant can be classified in this context.
     */
    private static ContextIntegrityWarning.Reason checkIntegrity(final MafVariant variant, final String trinucleotide) {
        if (trinucleotide.charAt(1) != Character.toUpperCase(variant.getReferenceAllele().charAt(0))) {
            return ContextIntegrityWarning.Reason.REFERENCE_MISMATCH;
        }
        if (!SubstitutionType.isClassifiable(SubstitutionClassifier.substitution(variant))) {
            return ContextIntegrityWarning.Reason.UNCLASSIFIABLE_SUBSTITUTION;
        }
        if (!BaseUtils.isNucleotide(trinucleotide.charAt(0)) || !BaseUtils.isNucleotide(trinucleotide.charAt(2))) {
            return ContextIntegrityWarning.Reason.AMBIGUOUS_FLANKING_BASE;
        }
        return null;
    }
}
