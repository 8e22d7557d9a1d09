package org.broadinstitute.signatures.engine;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.reference.FastaSequenceIndex;
import htsjdk.samtools.reference.FastaSequenceIndexEntry;
import htsjdk.samtools.reference.IndexedFastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import htsjdk.samtools.util.StringUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.signatures.exceptions.SignaturesException;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Manages traversals and queries over reference data in an indexed fasta file.
 *
 * Bases are upper-cased on retrieval. The sequence dictionary comes from the companion .dict file when
 * there is one, and is otherwise built from the .fai index.
 */
public final class ReferenceFileSource implements ReferenceDataSource {
    private static final Logger logger = LogManager.getLogger(ReferenceFileSource.class);

    private final Path fastaPath;
    private final IndexedFastaSequenceFile reference;
    private final SAMSequenceDictionary sequenceDictionary;

    /**
     * Initialize this data source using a fasta file.
     *
     * @param fastaPath reference fasta Path
     * @throws UserException.MissingReference if the fasta does not exist
     * @throws UserException.MissingReferenceFaiFile if the fasta has no .fai index
     */
    public ReferenceFileSource(final Path fastaPath) {
        this.fastaPath = Utils.nonNull(fastaPath);
        if (!Files.exists(fastaPath)) {
            throw new UserException.MissingReference("The specified fasta file (" + fastaPath.toUri() + ") does not exist.");
        }
        final Path indexPath = ReferenceSequenceFileFactory.getFastaIndexFileName(fastaPath);
        if (!Files.exists(indexPath)) {
            throw new UserException.MissingReferenceFaiFile(indexPath, fastaPath);
        }

        try {
            final FastaSequenceIndex index = new FastaSequenceIndex(indexPath);
            reference = new IndexedFastaSequenceFile(fastaPath, index);
            sequenceDictionary = reference.getSequenceDictionary() != null
                    ? reference.getSequenceDictionary()
                    : dictionaryFromIndex(index);
        } catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(fastaPath, e);
        }
        logger.debug("Opened reference " + fastaPath + " with " + sequenceDictionary.size() + " contigs");
    }

    private static SAMSequenceDictionary dictionaryFromIndex(final FastaSequenceIndex index) {
        final List<SAMSequenceRecord> records = new ArrayList<>();
        for (final FastaSequenceIndexEntry entry : index) {
            records.add(new SAMSequenceRecord(entry.getContig(), Math.toIntExact(entry.getSize())));
        }
        return new SAMSequenceDictionary(records);
    }

    @Override
    public ReferenceSequence queryAndPrefetch( final String contig, final long start , final long stop) {
        try {
            final ReferenceSequence sequence = reference.getSubsequenceAt(contig, start, stop);
            StringUtil.toUpperCase(sequence.getBases());
            return sequence;
        } catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(fastaPath, "failed to query " + contig + ":" + start + "-" + stop, e);
        }
    }

    @Override
    public SAMSequenceDictionary getSequenceDictionary() {
        return sequenceDictionary;
    }

    @Override
    public void close() {
        try {
            reference.close();
        }
        catch ( IOException e ) {
            throw new SignaturesException("Error closing reference file", e);
        }
    }
}
