package com.sparrowwallet.ballast.mempool;

import com.sparrowwallet.ballast.protocol.TxId;

import java.util.List;

public class MempoolTransactionsRemoved {
    private final List<TxId> txIds;
    private final RemovalReason reason;

    public MempoolTransactionsRemoved(List<TxId> txIds, RemovalReason reason) {
        this.txIds = txIds;
        this.reason = reason;
    }

    public List<TxId> getTxIds() {
        return txIds;
    }

    public RemovalReason getReason() {
        return reason;
    }
}
