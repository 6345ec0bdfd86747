package com.sparrowwallet.ballast.mempool;

public enum RemovalReason {
    UNKNOWN, EXPIRY, SIZELIMIT, REORG, BLOCK, CONFLICT
}
