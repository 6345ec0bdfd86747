package com.sparrowwallet.ballast.mempool;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.sparrowwallet.ballast.protocol.TxId;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An immutable bundle of entries that enters the primary mempool together. Members are held parents first
 * and the last member is the paying transaction whose fee is evaluated on behalf of the whole group.
 */
public final class CpfpGroup {
    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final GroupingData evaluationParams;
    private final ImmutableList<TxId> members;

    CpfpGroup(GroupingData evaluationParams, List<TxId> members) {
        Preconditions.checkArgument(!members.isEmpty(), "Group must have at least one member");
        this.id = NEXT_ID.getAndIncrement();
        this.evaluationParams = evaluationParams;
        this.members = ImmutableList.copyOf(members);
    }

    public long getId() {
        return id;
    }

    public GroupingData getEvaluationParams() {
        return evaluationParams;
    }

    public List<TxId> getMembers() {
        return members;
    }

    public TxId getPayingTxId() {
        return members.get(members.size() - 1);
    }

    public boolean isPayingTx(TxId txId) {
        return getPayingTxId().equals(txId);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return "CpfpGroup{" +
                "id=" + id +
                ", members=" + members.size() +
                ", fee=" + evaluationParams.getModifiedFee() +
                ", size=" + evaluationParams.size() +
                ", payingTx=" + getPayingTxId() +
                '}';
    }
}
