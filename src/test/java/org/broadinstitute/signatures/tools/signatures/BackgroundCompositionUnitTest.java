package org.broadinstitute.signatures.tools.signatures;

import org.testng.Assert;
import org.testng.annotations.Test;

public final class BackgroundCompositionUnitTest {

    @Test
    public void testOverlappingMotifsAndAmbiguousBases() {
        final BackgroundComposition composition = BackgroundComposition.of("TCATCTGAGAnTCAAGA");
        Assert.assertEquals(composition.getA(), 6);
        Assert.assertEquals(composition.getC(), 3);
        Assert.assertEquals(composition.getG(), 3);
        Assert.assertEquals(composition.getT(), 4);
        Assert.assertEquals(composition.getTca(), 2);
        Assert.assertEquals(composition.getTct(), 1);
        Assert.assertEquals(composition.getAga(), 2);
        Assert.assertEquals(composition.getTga(), 1);
        Assert.assertEquals(composition.getTcw(), 3);
        Assert.assertEquals(composition.getWga(), 3);
        Assert.assertEquals(composition.getBases(), 16);
    }

    @Test
    public void testLowerCaseIsCounted() {
        Assert.assertEquals(BackgroundComposition.of("tca"), BackgroundComposition.of("TCA"));
    }

    @Test
    public void testPlus() {
        final BackgroundComposition sum = BackgroundComposition.of("TCA").plus(BackgroundComposition.of("AGA"));
        Assert.assertEquals(sum, new BackgroundComposition(3, 1, 1, 1, 1, 0, 1, 0));
        Assert.assertEquals(BackgroundComposition.EMPTY.plus(sum), sum);
    }
}
