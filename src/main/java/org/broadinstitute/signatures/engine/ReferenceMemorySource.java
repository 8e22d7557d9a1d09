package org.broadinstitute.signatures.engine;

import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.signatures.utils.Utils;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Manages traversals and queries over in-memory reference data.
 */
public final class ReferenceMemorySource implements ReferenceDataSource {

    private final Map<String, byte[]> bases;
    private final SAMSequenceDictionary sequenceDictionary;

    /**
     * @param sequences bases of each contig, keyed by contig name; iteration order becomes the dictionary order.
     */
    public ReferenceMemorySource(final Map<String, String> sequences) {
        Utils.nonNull(sequences);
        this.bases = new LinkedHashMap<>();
        final List<SAMSequenceRecord> records = new ArrayList<>();
        for (final Map.Entry<String, String> entry : sequences.entrySet()) {
            Utils.nonEmpty(entry.getValue(), "contig " + entry.getKey() + " has no bases");
            final byte[] contigBases = entry.getValue().getBytes(StandardCharsets.US_ASCII);
            StringUtil.toUpperCase(contigBases);
            bases.put(entry.getKey(), contigBases);
            records.add(new SAMSequenceRecord(entry.getKey(), contigBases.length));
        }
        this.sequenceDictionary = new SAMSequenceDictionary(records);
    }

    @Override
    public ReferenceSequence queryAndPrefetch( final String contig, final long start , final long stop) {
        final byte[] contigBases = bases.get(contig);
        Utils.validateArg(contigBases != null, () -> "unknown contig " + contig);
        final int contigIndex = sequenceDictionary.getSequenceIndex(contig);
        final int startIndex = (int)(start - 1);
        final int length = (int)(stop - start + 1);
        Utils.validateArg(length >= 0, () -> String.format("Asking for stop<start (%d < %d)", stop, start));
        Utils.validIndex(startIndex, contigBases.length);
        Utils.validateArg(startIndex + length <= contigBases.length, () -> String.format("Asking for stop %d on contig %s but it is only %d bases long.", stop, contig, contigBases.length));
        return new ReferenceSequence(contig, contigIndex, Arrays.copyOfRange(contigBases, startIndex, startIndex + length));
    }

    @Override
    public SAMSequenceDictionary getSequenceDictionary() {
        return sequenceDictionary;
    }
}
