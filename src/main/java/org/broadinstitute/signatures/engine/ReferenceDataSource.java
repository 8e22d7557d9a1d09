package org.broadinstitute.signatures.engine;

import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.reference.ReferenceSequence;
import org.broadinstitute.signatures.utils.Utils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Manages traversals and queries over reference data.
 *
 * Supports targeted queries over the reference by interval. Coordinates are 1-based and inclusive.
 * Instances are created once, queried many times and released by the caller with {@link #close()}.
 */
public interface ReferenceDataSource extends AutoCloseable {

    /**
     * Initialize this data source using a fasta file.
     *
     * The provided fasta file must have companion .fai index file.
     *
     * @param fastaPath reference fasta Path
     */
    public static ReferenceDataSource of(final Path fastaPath) {
        return new ReferenceFileSource(fastaPath);
    }

    /**
     * Initialize this data source using in-memory sequences, keyed by contig name in dictionary order.
     */
    public static ReferenceDataSource of(final Map<String, String> sequences) {
        return new ReferenceMemorySource(sequences);
    }

    /**
     * Query a specific interval on this reference, and get back all bases spanning that interval at once.
     *
     * @param contig query interval contig
     * @param start query interval start
     * @param stop query interval stop (included)
     * @return a ReferenceSequence containing all bases spanning the query interval, prefetched
     */
    public ReferenceSequence queryAndPrefetch(final String contig, final long start , final long stop);

    /**
     * The bases of {@code contig:start-end} as an upper-case string; ambiguity codes are kept.
     *
     * @throws IllegalArgumentException if the contig is unknown or the range falls outside of it.
     */
    default public String getSequence(final String contig, final int start, final int end) {
        Utils.validateArg(listContigs().contains(contig), () -> "unknown contig " + contig);
        Utils.validateArg(start >= 1 && end >= start && end <= getContigLength(contig),
                () -> String.format("%s:%d-%d is outside of the contig bounds", contig, start, end));
        return new String(queryAndPrefetch(contig, start, end).getBases(), StandardCharsets.US_ASCII);
    }

    /**
     * Names of all the contigs in this reference, in dictionary order.
     */
    default public Set<String> listContigs() {
        final Set<String> contigs = new LinkedHashSet<>();
        for (final SAMSequenceRecord record : getSequenceDictionary().getSequences()) {
            contigs.add(record.getSequenceName());
        }
        return Collections.unmodifiableSet(contigs);
    }

    /**
     * @return the length of the contig, or -1 if the reference does not have it.
     */
    default public int getContigLength(final String contig) {
        final SAMSequenceRecord record = getSequenceDictionary().getSequence(Utils.nonNull(contig));
        return record == null ? -1 : record.getSequenceLength();
    }

    /**
     * Get the sequence dictionary for this reference
     *
     * @return SAMSequenceDictionary for this reference
     */
    public SAMSequenceDictionary getSequenceDictionary();

    /**
     * Permanently close this data source. The default implementation does nothing.
     */
    @Override
    default public void close(){
        //do nothing
    }
}
