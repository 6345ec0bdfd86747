package com.sparrowwallet.ballast.protocol;

import com.google.common.base.Preconditions;

/**
 * Fee rate in satoshis per 1000 bytes.
 */
public record FeeRate(long satoshisPerK) implements Comparable<FeeRate> {
    public static final FeeRate ZERO = new FeeRate(0);

    public static FeeRate of(long fee, long size) {
        Preconditions.checkArgument(size >= 0, "Size cannot be negative");
        if(size == 0) {
            return ZERO;
        }

        return new FeeRate(fee * 1000 / size);
    }

    /**
     * Fee for a transaction of the given size, never rounded down to zero for a non-zero rate and size.
     */
    public long getFee(long size) {
        long fee = satoshisPerK * size / 1000;
        if(fee == 0 && size != 0) {
            if(satoshisPerK > 0) {
                fee = 1;
            } else if(satoshisPerK < 0) {
                fee = -1;
            }
        }

        return fee;
    }

    public FeeRate add(FeeRate other) {
        return new FeeRate(satoshisPerK + other.satoshisPerK);
    }

    @Override
    public int compareTo(FeeRate o) {
        return Long.compare(satoshisPerK, o.satoshisPerK);
    }

    @Override
    public String toString() {
        return satoshisPerK + " sat/kB";
    }
}
