package org.broadinstitute.signatures.engine;

import com.google.common.collect.ImmutableMap;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;

public class ReferenceMemorySourceUnitTest {

    private final ReferenceDataSource reference = ReferenceDataSource.of(ImmutableMap.of(
            "2", "acgtNNacgt",
            "1", "TTTCAGGG"));

    @Test
    public void testDictionaryKeepsInputOrder() {
        Assert.assertEquals(new ArrayList<>(reference.listContigs()), Arrays.asList("2", "1"));
        Assert.assertEquals(reference.getContigLength("1"), 8);
    }

    @Test
    public void testBasesAreUpperCasedAndAmbiguityCodesKept() {
        Assert.assertEquals(reference.getSequence("2", 3, 8), "GTNNAC");
    }

    @Test
    public void testGetSequence() {
        Assert.assertEquals(reference.getSequence("1", 3, 5), "TCA");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testQueryOutOfBounds() {
        reference.queryAndPrefetch("1", 6, 9);
    }
}
