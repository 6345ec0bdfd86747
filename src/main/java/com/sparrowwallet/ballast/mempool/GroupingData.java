package com.sparrowwallet.ballast.mempool;

/**
 * Aggregated fee and size of a secondary entry together with the still-secondary ancestors it would have to pay for.
 * For a secondary entry the values are an approximation since shared ancestors are counted once per path.
 */
public record GroupingData(long fee, long feeDelta, long size, long ancestorsCount) {
    public static final GroupingData EMPTY = new GroupingData(0, 0, 0, 0);

    public static GroupingData of(MempoolEntry entry) {
        return new GroupingData(entry.getFee(), entry.getFeeDelta(), entry.getSize(), 0);
    }

    public GroupingData plusAncestor(GroupingData ancestor) {
        return new GroupingData(fee + ancestor.fee, feeDelta + ancestor.feeDelta, size + ancestor.size, ancestorsCount + ancestor.ancestorsCount + 1);
    }

    public GroupingData plus(MempoolEntry entry) {
        return new GroupingData(fee + entry.getFee(), feeDelta + entry.getFeeDelta(), size + entry.getSize(), ancestorsCount);
    }

    public long getModifiedFee() {
        return fee + feeDelta;
    }
}
