package com.sparrowwallet.ballast.protocol;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FeeRateTest {
    @Test
    public void testGetFee() {
        FeeRate feeRate = new FeeRate(500);
        Assertions.assertEquals(500, feeRate.getFee(1000));
        Assertions.assertEquals(125, feeRate.getFee(250));
        Assertions.assertEquals(1, feeRate.getFee(1));
        Assertions.assertEquals(0, feeRate.getFee(0));
        Assertions.assertEquals(-1, new FeeRate(-10).getFee(5));
        Assertions.assertEquals(0, FeeRate.ZERO.getFee(1000));
    }

    @Test
    public void testOf() {
        Assertions.assertEquals(new FeeRate(500), FeeRate.of(1500, 3000));
        Assertions.assertEquals(FeeRate.ZERO, FeeRate.of(1000, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> FeeRate.of(1000, -1));
    }

    @Test
    public void testAddAndCompare() {
        FeeRate sum = new FeeRate(500).add(new FeeRate(1000));
        Assertions.assertEquals(new FeeRate(1500), sum);
        Assertions.assertTrue(sum.compareTo(new FeeRate(1000)) > 0);
        Assertions.assertEquals("1500 sat/kB", sum.toString());
    }
}
