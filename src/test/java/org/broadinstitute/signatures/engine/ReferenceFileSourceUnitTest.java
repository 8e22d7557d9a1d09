package org.broadinstitute.signatures.engine;

import org.broadinstitute.signatures.SignaturesBaseTest;
import org.broadinstitute.signatures.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.ArrayList;

public final class ReferenceFileSourceUnitTest extends SignaturesBaseTest {

    @Test
    public void testContigsAndLengths() {
        try (final ReferenceDataSource reference = ReferenceDataSource.of(Paths.get(trinucleotideReference))) {
            Assert.assertEquals(new ArrayList<>(reference.listContigs()), Arrays.asList("chr1", "chr2"));
            Assert.assertEquals(reference.getContigLength("chr1"), 120);
            Assert.assertEquals(reference.getContigLength("chr2"), 60);
            Assert.assertEquals(reference.getContigLength("chr3"), -1);
        }
    }

    @Test
    public void testGetSequence() {
        try (final ReferenceDataSource reference = ReferenceDataSource.of(Paths.get(trinucleotideReference))) {
            Assert.assertEquals(reference.getSequence("chr1", 1, 10), "AAAACGAGAA");
            Assert.assertEquals(reference.getSequence("chr1", 29, 31), "TCA");
            Assert.assertEquals(reference.getSequence("chr1", 89, 91), "GAG");
            Assert.assertEquals(reference.getSequence("chr1", 116, 120), "CTGAA");
            Assert.assertEquals(reference.getSequence("chr2", 1, 10), "CACAAGGAGT");
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testGetSequencePastContigEnd() {
        try (final ReferenceDataSource reference = ReferenceDataSource.of(Paths.get(trinucleotideReference))) {
            reference.getSequence("chr2", 55, 61);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testGetSequenceUnknownContig() {
        try (final ReferenceDataSource reference = ReferenceDataSource.of(Paths.get(trinucleotideReference))) {
            reference.getSequence("chr3", 1, 3);
        }
    }

    @Test(expectedExceptions = UserException.MissingReference.class)
    public void testMissingFasta() {
        ReferenceDataSource.of(new File(createTempDir("reference"), "absent.fasta").toPath());
    }

    @Test(expectedExceptions = UserException.MissingReferenceFaiFile.class)
    public void testMissingIndex() throws IOException {
        final Path copy = new File(createTempDir("reference"), "unindexed.fasta").toPath();
        Files.copy(Paths.get(trinucleotideReference), copy);
        copy.toFile().deleteOnExit();
        ReferenceDataSource.of(copy);
    }
}
