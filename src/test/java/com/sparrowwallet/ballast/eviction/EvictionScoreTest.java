package com.sparrowwallet.ballast.eviction;

import com.sparrowwallet.ballast.mempool.MempoolEntry;
import com.sparrowwallet.ballast.mempool.MempoolTestAccess;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class EvictionScoreTest {
    @Test
    public void testPrimaryScore() {
        MempoolEntry entry = MempoolTestAccess.entry(1500, 250, 1, MempoolTestAccess.confirmedInput());
        Assertions.assertEquals(1500L * 100000 / 250, EvictionScore.score(entry));
    }

    @Test
    public void testSecondaryBelowEveryPrimary() {
        MempoolEntry richSecondary = MempoolTestAccess.entry(Long.MAX_VALUE / 2, 100, 1, MempoolTestAccess.confirmedInput());
        MempoolTestAccess.makeSecondary(richSecondary);
        MempoolEntry poorPrimary = MempoolTestAccess.entry(-1000000, 100000, 1, MempoolTestAccess.confirmedInput());

        Assertions.assertTrue(EvictionScore.score(richSecondary) < EvictionScore.score(poorPrimary));
        Assertions.assertTrue(EvictionScore.score(poorPrimary) < 0);
    }

    @Test
    public void testGroupPayerScoredByGroup() {
        MempoolEntry parent = MempoolTestAccess.entry(0, 1000, 1, MempoolTestAccess.confirmedInput());
        MempoolEntry payer = MempoolTestAccess.entry(3000, 500, 1, parent.getTransaction().getOutput(0));
        MempoolTestAccess.setInsertionIndex(parent, 0);
        MempoolTestAccess.setInsertionIndex(payer, 1);
        MempoolTestAccess.group(List.of(parent, payer));

        Assertions.assertEquals(3000L * 100000 / 1500, EvictionScore.score(payer));
    }

    @Test
    public void testScaledRateClamps() {
        Assertions.assertEquals((1L << 61) - 1, EvictionScore.scaledRate(Long.MAX_VALUE, 1));
        Assertions.assertEquals(-(1L << 61), EvictionScore.scaledRate(Long.MIN_VALUE + 1, 1));
        Assertions.assertEquals(0, EvictionScore.scaledRate(0, 1000));
        Assertions.assertTrue(EvictionScore.scaledRate(Long.MIN_VALUE + 1, 1) - EvictionScore.SECONDARY_OFFSET < EvictionScore.scaledRate(Long.MIN_VALUE + 1, 1));
    }
}
