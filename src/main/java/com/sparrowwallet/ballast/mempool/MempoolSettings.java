package com.sparrowwallet.ballast.mempool;

import com.google.common.base.Preconditions;
import com.sparrowwallet.ballast.eviction.EvictionCandidateTracker;
import com.sparrowwallet.ballast.protocol.FeeRate;

import java.time.Duration;

public record MempoolSettings(FeeRate blockMinTxFee, FeeRate incrementalRelayFee, long maxMempool, int limitAncestorCount,
                              int limitSecondaryMempoolAncestorCount, Duration mempoolExpiry, Duration rollingFeeHalflife,
                              double evictionCompactionRatio) {
    public static final FeeRate DEFAULT_BLOCK_MIN_TX_FEE = new FeeRate(500);
    public static final FeeRate DEFAULT_INCREMENTAL_RELAY_FEE = new FeeRate(1000);
    public static final long DEFAULT_MAX_MEMPOOL = 1000L * 1000 * 1000;
    public static final int DEFAULT_ANCESTOR_LIMIT = 25;
    public static final int DEFAULT_SECONDARY_MEMPOOL_ANCESTOR_LIMIT = 25;
    public static final Duration DEFAULT_MEMPOOL_EXPIRY = Duration.ofHours(336);
    public static final Duration DEFAULT_ROLLING_FEE_HALFLIFE = Duration.ofHours(12);
    public static final Duration MIN_ROLLING_FEE_HALFLIFE = Duration.ofMinutes(30);

    public static final MempoolSettings DEFAULT = new MempoolSettings(DEFAULT_BLOCK_MIN_TX_FEE, DEFAULT_INCREMENTAL_RELAY_FEE, DEFAULT_MAX_MEMPOOL,
            DEFAULT_ANCESTOR_LIMIT, DEFAULT_SECONDARY_MEMPOOL_ANCESTOR_LIMIT, DEFAULT_MEMPOOL_EXPIRY, DEFAULT_ROLLING_FEE_HALFLIFE,
            EvictionCandidateTracker.DEFAULT_MAX_INVALID_TO_VALID_RATIO);

    public MempoolSettings {
        Preconditions.checkArgument(blockMinTxFee.satoshisPerK() >= 0, "Block minimum transaction fee cannot be negative");
        Preconditions.checkArgument(incrementalRelayFee.satoshisPerK() >= 0, "Incremental relay fee cannot be negative");
        Preconditions.checkArgument(maxMempool > 0, "Maximum mempool size must be positive");
        Preconditions.checkArgument(limitAncestorCount > 0, "Ancestor limit must be positive");
        Preconditions.checkArgument(limitSecondaryMempoolAncestorCount > 0, "Secondary mempool ancestor limit must be positive");
        Preconditions.checkArgument(!rollingFeeHalflife.minus(MIN_ROLLING_FEE_HALFLIFE).isNegative(), "Rolling fee halflife must be at least " + MIN_ROLLING_FEE_HALFLIFE.toMinutes() + " minutes");
        Preconditions.checkArgument(evictionCompactionRatio >= 0, "Eviction compaction ratio cannot be negative");
    }

    public MempoolSettings withBlockMinTxFee(FeeRate blockMinTxFee) {
        return new MempoolSettings(blockMinTxFee, incrementalRelayFee, maxMempool, limitAncestorCount, limitSecondaryMempoolAncestorCount,
                mempoolExpiry, rollingFeeHalflife, evictionCompactionRatio);
    }
}
