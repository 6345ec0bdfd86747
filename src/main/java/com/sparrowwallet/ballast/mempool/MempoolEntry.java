package com.sparrowwallet.ballast.mempool;

import com.google.common.base.Preconditions;
import com.sparrowwallet.ballast.protocol.Transaction;
import com.sparrowwallet.ballast.protocol.TxId;

import java.util.Optional;

public class MempoolEntry {
    //Bookkeeping bytes charged per entry on top of the transaction body
    public static final int ENTRY_OVERHEAD = 200;

    private final Transaction transaction;
    private final long fee;
    private final long time;
    private final TxStorage storage;

    private long insertionIndex = -1;
    private long feeDelta;
    private Admission admission = Admission.STANDALONE;

    public MempoolEntry(Transaction transaction, long fee, long time) {
        this(transaction, fee, time, TxStorage.MEMORY);
    }

    public MempoolEntry(Transaction transaction, long fee, long time, TxStorage storage) {
        this.transaction = Preconditions.checkNotNull(transaction);
        this.fee = fee;
        this.time = time;
        this.storage = storage;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public TxId getTxId() {
        return transaction.getTxId();
    }

    public long getFee() {
        return fee;
    }

    public long getFeeDelta() {
        return feeDelta;
    }

    void setFeeDelta(long feeDelta) {
        this.feeDelta = feeDelta;
    }

    public long getModifiedFee() {
        return fee + feeDelta;
    }

    public int getSize() {
        return transaction.getSize();
    }

    /**
     * Bytes of memory this entry accounts for. Bodies held on disk only charge the overhead.
     */
    public long getUsageSize() {
        return (storage == TxStorage.MEMORY ? transaction.getSize() : 0) + ENTRY_OVERHEAD;
    }

    public long getTime() {
        return time;
    }

    public TxStorage getStorage() {
        return storage;
    }

    public long getInsertionIndex() {
        return insertionIndex;
    }

    void setInsertionIndex(long insertionIndex) {
        this.insertionIndex = insertionIndex;
    }

    public Admission getAdmission() {
        return admission;
    }

    void setAdmission(Admission admission) {
        this.admission = Preconditions.checkNotNull(admission);
    }

    public boolean isInPrimaryMempool() {
        return admission.isPrimary();
    }

    public boolean isCpfpGroupMember() {
        return admission instanceof Admission.Grouped;
    }

    public Optional<CpfpGroup> getCpfpGroup() {
        if(admission instanceof Admission.Grouped grouped) {
            return Optional.of(grouped.group());
        }

        return Optional.empty();
    }

    public Optional<GroupingData> getGroupingData() {
        if(admission instanceof Admission.Secondary secondary) {
            return Optional.of(secondary.groupingData());
        }

        return Optional.empty();
    }

    @Override
    public String toString() {
        return "MempoolEntry{" +
                "txId=" + getTxId() +
                ", fee=" + fee +
                ", feeDelta=" + feeDelta +
                ", size=" + getSize() +
                ", insertionIndex=" + insertionIndex +
                ", admission=" + admission +
                '}';
    }
}
