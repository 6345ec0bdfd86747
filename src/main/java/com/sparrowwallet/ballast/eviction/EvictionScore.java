package com.sparrowwallet.ballast.eviction;

import com.sparrowwallet.ballast.mempool.CpfpGroup;
import com.sparrowwallet.ballast.mempool.GroupingData;
import com.sparrowwallet.ballast.mempool.MempoolEntry;

import java.util.Optional;

/**
 * Default worthlessness score: modified fee per 100000 bytes, with a group's paying transaction scored by the
 * group aggregate. Secondary entries are shifted into a band below every primary score.
 */
public final class EvictionScore {
    private static final long SCALE = 100000;
    private static final long MAX_RATE = (1L << 61) - 1;
    private static final long MIN_RATE = -(1L << 61);
    static final long SECONDARY_OFFSET = 1L << 62;

    private EvictionScore() {
    }

    public static long score(MempoolEntry entry) {
        long fee = entry.getModifiedFee();
        long size = entry.getSize();
        Optional<CpfpGroup> optGroup = entry.getCpfpGroup();
        if(optGroup.isPresent()) {
            GroupingData evaluationParams = optGroup.get().getEvaluationParams();
            fee = evaluationParams.getModifiedFee();
            size = evaluationParams.size();
        }

        long rate = scaledRate(fee, size);
        if(!entry.isInPrimaryMempool()) {
            return rate - SECONDARY_OFFSET;
        }

        return rate;
    }

    static long scaledRate(long fee, long size) {
        if(size <= 0) {
            return fee < 0 ? MIN_RATE : MAX_RATE;
        }

        if(Math.abs(fee) > Long.MAX_VALUE / SCALE) {
            return fee < 0 ? MIN_RATE : MAX_RATE;
        }

        return Math.max(MIN_RATE, Math.min(MAX_RATE, fee * SCALE / size));
    }
}
