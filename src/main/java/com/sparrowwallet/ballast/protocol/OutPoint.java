package com.sparrowwallet.ballast.protocol;

public record OutPoint(TxId txId, int index) {
    @Override
    public String toString() {
        return txId + ":" + index;
    }
}
