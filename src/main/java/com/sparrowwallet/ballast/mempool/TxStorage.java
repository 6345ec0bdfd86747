package com.sparrowwallet.ballast.mempool;

public enum TxStorage {
    MEMORY, DISK
}
