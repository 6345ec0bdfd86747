package com.sparrowwallet.ballast.mempool;

import com.sparrowwallet.ballast.protocol.TxId;

import java.util.Set;

public class PrimaryMempoolChanged {
    private final Set<TxId> accepted;
    private final Set<TxId> removed;

    public PrimaryMempoolChanged(Set<TxId> accepted, Set<TxId> removed) {
        this.accepted = accepted;
        this.removed = removed;
    }

    public Set<TxId> getAccepted() {
        return accepted;
    }

    public Set<TxId> getRemoved() {
        return removed;
    }
}
