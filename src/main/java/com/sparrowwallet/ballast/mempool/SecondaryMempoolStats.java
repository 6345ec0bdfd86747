package com.sparrowwallet.ballast.mempool;

public record SecondaryMempoolStats(int count, long usage) {
}
